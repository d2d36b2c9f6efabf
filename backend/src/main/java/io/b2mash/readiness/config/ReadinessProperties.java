package io.b2mash.readiness.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for attendance aggregation, absence detection, grading and the finalizer job.
 *
 * @param defaultTimezone zone used when a company has none or an invalid one
 * @param recompute limits for event-triggered summary rebuilds
 * @param absence absence detection and listing settings
 * @param grading grading defaults
 * @param finalizer scheduled end-of-day job settings
 */
@ConfigurationProperties(prefix = "readiness")
public record ReadinessProperties(
    String defaultTimezone,
    Recompute recompute,
    Absence absence,
    Grading grading,
    Finalizer finalizer) {

  /**
   * @param maxDays longest date range a single triggered rebuild will walk
   * @param budget wall-clock budget for a single triggered rebuild
   * @param executor sizing of the rebuild executor
   */
  public record Recompute(int maxDays, Duration budget, Executor executor) {}

  public record Executor(int corePoolSize, int maxPoolSize, int queueCapacity) {}

  /**
   * @param detectionLookbackDays how far back detection scans for missed days
   * @param historyLimit default page size of a member's absence history
   */
  public record Absence(int detectionLookbackDays, int historyLimit) {}

  public record Grading(int defaultPeriodDays) {}

  /**
   * @param enabled whether the hourly finalizer runs at all
   * @param hour company-local hour at which yesterday is finalized
   */
  public record Finalizer(boolean enabled, int hour) {}
}
