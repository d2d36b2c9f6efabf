package io.b2mash.readiness.company;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a company's {@link ZoneId}. Aggregation asks for it once per (team, date), so lookups
 * are cached. An unparseable stored zone falls back to the configured default.
 */
@Component
public class CompanyZoneResolver {

  private static final Logger log = LoggerFactory.getLogger(CompanyZoneResolver.class);

  private final CompanyRepository companyRepository;
  private final ZoneId defaultZone;
  private final Cache<UUID, ZoneId> zoneCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(30)).build();

  public CompanyZoneResolver(CompanyRepository companyRepository, ReadinessProperties properties) {
    this.companyRepository = companyRepository;
    this.defaultZone = ZoneId.of(properties.defaultTimezone());
  }

  public ZoneId zoneOf(UUID companyId) {
    return zoneCache.get(companyId, this::loadZone);
  }

  public ZoneId defaultZone() {
    return defaultZone;
  }

  private ZoneId loadZone(UUID companyId) {
    var company =
        companyRepository
            .findById(companyId)
            .orElseThrow(() -> new ResourceNotFoundException("Company", companyId));
    return parseZone(company.getTimezone());
  }

  ZoneId parseZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return defaultZone;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      log.warn("Invalid company timezone '{}', falling back to {}", timezone, defaultZone);
      return defaultZone;
    }
  }
}
