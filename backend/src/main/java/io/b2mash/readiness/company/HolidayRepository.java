package io.b2mash.readiness.company;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HolidayRepository extends JpaRepository<Holiday, UUID> {

  boolean existsByCompanyIdAndHolidayDate(UUID companyId, LocalDate holidayDate);

  @Query(
      """
      SELECT h FROM Holiday h
      WHERE h.companyId = :companyId
        AND h.holidayDate BETWEEN :from AND :to
      ORDER BY h.holidayDate
      """)
  List<Holiday> findByCompanyIdAndDateRange(
      @Param("companyId") UUID companyId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);
}
