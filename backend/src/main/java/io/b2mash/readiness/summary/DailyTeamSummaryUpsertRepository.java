package io.b2mash.readiness.summary;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Writes {@link DailyTeamSummary} rows keyed by (team_id, summary_date). Every column is replaced
 * on conflict, so the stored row always equals the latest computation.
 */
@Repository
public class DailyTeamSummaryUpsertRepository {

  private final JdbcClient jdbc;

  public DailyTeamSummaryUpsertRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public void upsert(DailyAttendanceFigures figures) {
    jdbc.sql(
            """
            INSERT INTO daily_team_summaries
                (id, team_id, company_id, summary_date, is_work_day, is_holiday,
                 total_members, on_leave_count, excused_count, absent_count,
                 expected_to_check_in, checked_in_count, green_count, yellow_count, red_count,
                 avg_readiness_score, compliance_rate, updated_at)
            VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now())
            ON CONFLICT (team_id, summary_date)
            DO UPDATE SET company_id = EXCLUDED.company_id,
                          is_work_day = EXCLUDED.is_work_day,
                          is_holiday = EXCLUDED.is_holiday,
                          total_members = EXCLUDED.total_members,
                          on_leave_count = EXCLUDED.on_leave_count,
                          excused_count = EXCLUDED.excused_count,
                          absent_count = EXCLUDED.absent_count,
                          expected_to_check_in = EXCLUDED.expected_to_check_in,
                          checked_in_count = EXCLUDED.checked_in_count,
                          green_count = EXCLUDED.green_count,
                          yellow_count = EXCLUDED.yellow_count,
                          red_count = EXCLUDED.red_count,
                          avg_readiness_score = EXCLUDED.avg_readiness_score,
                          compliance_rate = EXCLUDED.compliance_rate,
                          updated_at = now()
            """)
        .params(
            figures.teamId(),
            figures.companyId(),
            figures.date(),
            figures.workDay(),
            figures.holiday(),
            figures.totalMembers(),
            figures.onLeaveCount(),
            figures.excusedCount(),
            figures.absentCount(),
            figures.expectedToCheckIn(),
            figures.checkedInCount(),
            figures.greenCount(),
            figures.yellowCount(),
            figures.redCount(),
            figures.avgReadinessScore(),
            figures.complianceRate())
        .update();
  }
}
