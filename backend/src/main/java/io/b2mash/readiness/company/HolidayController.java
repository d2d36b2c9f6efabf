package io.b2mash.readiness.company;

import io.b2mash.readiness.scope.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HolidayController {

  private final HolidayService holidayService;

  public HolidayController(HolidayService holidayService) {
    this.holidayService = holidayService;
  }

  @GetMapping("/api/companies/{companyId}/holidays")
  public ResponseEntity<List<HolidayResponse>> listHolidays(
      @PathVariable UUID companyId, @RequestParam(required = false) Integer year) {
    int resolvedYear = year != null ? year : LocalDate.now().getYear();
    var holidays =
        holidayService.listHolidays(RequestScopes.requireScope(), companyId, resolvedYear);
    return ResponseEntity.ok(holidays.stream().map(HolidayResponse::from).toList());
  }

  @PostMapping("/api/companies/{companyId}/holidays")
  public ResponseEntity<HolidayResponse> createHoliday(
      @PathVariable UUID companyId, @Valid @RequestBody CreateHolidayRequest request) {
    var holiday =
        holidayService.createHoliday(
            RequestScopes.requireScope(), companyId, request.date(), request.name());
    return ResponseEntity.created(URI.create("/api/holidays/" + holiday.getId()))
        .body(HolidayResponse.from(holiday));
  }

  @DeleteMapping("/api/holidays/{id}")
  public ResponseEntity<Void> deleteHoliday(@PathVariable UUID id) {
    holidayService.deleteHoliday(RequestScopes.requireScope(), id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateHolidayRequest(
      @NotNull LocalDate date, @NotBlank @Size(max = 255) String name) {}

  public record HolidayResponse(UUID id, UUID companyId, LocalDate date, String name) {

    public static HolidayResponse from(Holiday holiday) {
      return new HolidayResponse(
          holiday.getId(), holiday.getCompanyId(), holiday.getHolidayDate(), holiday.getName());
    }
  }
}
