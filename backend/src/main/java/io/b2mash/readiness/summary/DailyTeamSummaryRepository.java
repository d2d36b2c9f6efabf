package io.b2mash.readiness.summary;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DailyTeamSummaryRepository extends JpaRepository<DailyTeamSummary, UUID> {

  Optional<DailyTeamSummary> findByTeamIdAndSummaryDate(UUID teamId, LocalDate summaryDate);

  List<DailyTeamSummary> findByTeamIdAndSummaryDateBetweenOrderBySummaryDate(
      UUID teamId, LocalDate from, LocalDate to);
}
