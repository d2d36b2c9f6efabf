package io.b2mash.readiness.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Company-wide non-working date. Suppresses the check-in requirement for every team. */
@Entity
@Table(name = "holidays")
public class Holiday {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "holiday_date", nullable = false, updatable = false)
  private LocalDate holidayDate;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Holiday() {}

  public Holiday(UUID companyId, LocalDate holidayDate, String name, UUID createdBy) {
    this.companyId = companyId;
    this.holidayDate = holidayDate;
    this.name = name;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public LocalDate getHolidayDate() {
    return holidayDate;
  }

  public String getName() {
    return name;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
