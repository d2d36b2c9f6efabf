package io.b2mash.readiness.absence;

import java.time.LocalDate;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Insert path for detected absences. The unique (member_id, absence_date) constraint resolves
 * concurrent detection runs: a losing insert is a no-op, not an error.
 */
@Repository
public class AbsenceDetectionRepository {

  private final JdbcClient jdbc;

  public AbsenceDetectionRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /** Returns true if a new absence row was created. */
  public boolean insertIfAbsent(UUID memberId, UUID teamId, UUID companyId, LocalDate date) {
    int rows =
        jdbc.sql(
                """
                INSERT INTO absences
                    (id, member_id, team_id, company_id, absence_date, status,
                     created_at, updated_at)
                VALUES (gen_random_uuid(), ?, ?, ?, ?, 'PENDING_JUSTIFICATION', now(), now())
                ON CONFLICT (member_id, absence_date) DO NOTHING
                """)
            .params(memberId, teamId, companyId, date)
            .update();
    return rows > 0;
  }
}
