package io.b2mash.readiness.company;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.readiness.TestcontainersConfiguration;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.scope.CallerFilter;
import io.b2mash.readiness.team.TeamRepository;
import io.b2mash.readiness.testutil.TestOrgFactory;
import io.b2mash.readiness.testutil.TestOrgFactory.TestOrg;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class HolidayControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private CompanyRepository companyRepository;
  @Autowired private TeamRepository teamRepository;
  @Autowired private MemberRepository memberRepository;

  private TestOrg org;
  private LocalDate today;
  private String holidayId;

  @BeforeAll
  void seedOrganisation() {
    org =
        TestOrgFactory.create(
            companyRepository, teamRepository, memberRepository, "Holiday", Instant.now());
    today = LocalDate.now(ZoneOffset.UTC);
  }

  @Test
  @Order(1)
  void createHoliday_supervisorCreates() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/companies/" + org.company().getId() + "/holidays")
                    .header(CallerFilter.MEMBER_HEADER, org.supervisor().getId().toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"date": "%s", "name": "Founders Day"}
                        """
                            .formatted(today)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.date").value(today.toString()))
            .andExpect(jsonPath("$.name").value("Founders Day"))
            .andReturn();
    holidayId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  @Test
  @Order(2)
  void createHoliday_duplicateDateConflicts() throws Exception {
    mockMvc
        .perform(
            post("/api/companies/" + org.company().getId() + "/holidays")
                .header(CallerFilter.MEMBER_HEADER, org.supervisor().getId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"date": "%s", "name": "Second"}
                    """
                        .formatted(today)))
        .andExpect(status().isConflict());
  }

  @Test
  @Order(3)
  void createHoliday_forbiddenForTeamLead() throws Exception {
    mockMvc
        .perform(
            post("/api/companies/" + org.company().getId() + "/holidays")
                .header(CallerFilter.MEMBER_HEADER, org.lead().getId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"date": "%s", "name": "Lead Day"}
                    """
                        .formatted(today.plusDays(1))))
        .andExpect(status().isForbidden());
  }

  @Test
  @Order(4)
  void listHolidays_visibleToWorkers() throws Exception {
    mockMvc
        .perform(
            get("/api/companies/" + org.company().getId() + "/holidays")
                .param("year", String.valueOf(today.getYear()))
                .header(CallerFilter.MEMBER_HEADER, org.worker().getId().toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(holidayId));
  }

  @Test
  @Order(5)
  void checkin_rejectedOnHoliday() throws Exception {
    mockMvc
        .perform(
            post("/api/checkins")
                .header(CallerFilter.MEMBER_HEADER, org.worker().getId().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"mood": 7, "stress": 3, "sleep": 7, "physicalHealth": 7}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(6)
  void holidayChanges_areAudited() throws Exception {
    mockMvc
        .perform(
            get("/api/audit-events")
                .param("entityType", "holiday")
                .param("entityId", holidayId)
                .header(CallerFilter.MEMBER_HEADER, org.supervisor().getId().toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].actionTag").value("holiday.created"))
        .andExpect(jsonPath("$[0].metadata.actor_name").value("Holiday Supervisor"));
  }

  @Test
  @Order(7)
  void auditTrail_forbiddenForWorkers() throws Exception {
    mockMvc
        .perform(
            get("/api/audit-events")
                .param("entityType", "holiday")
                .param("entityId", holidayId)
                .header(CallerFilter.MEMBER_HEADER, org.worker().getId().toString()))
        .andExpect(status().isForbidden());
  }

  @Test
  @Order(8)
  void deleteHoliday_removesIt() throws Exception {
    mockMvc
        .perform(
            delete("/api/holidays/" + holidayId)
                .header(CallerFilter.MEMBER_HEADER, org.supervisor().getId().toString()))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(
            get("/api/companies/" + org.company().getId() + "/holidays")
                .param("year", String.valueOf(today.getYear()))
                .header(CallerFilter.MEMBER_HEADER, org.supervisor().getId().toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }
}
