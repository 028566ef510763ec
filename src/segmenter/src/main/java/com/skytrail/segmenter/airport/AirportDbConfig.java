package com.skytrail.segmenter.airport;

import com.skytrail.segmenter.config.ScopeMode;
import com.skytrail.segmenter.config.SegmenterProperties;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the route scope.
 *
 * <p>The in-scope airport set is the union of {@code segmenter.scope.airports} and, when the
 * airport DB is enabled, every airport of {@code segmenter.scope.iso-country}.
 */
@Configuration
public class AirportDbConfig {
  private static final Logger log = LoggerFactory.getLogger(AirportDbConfig.class);

  /**
   * Creates the airport repository when {@code segmenter.airport-db.enabled=true}.
   *
   * @param properties segmenter configuration properties
   * @return repository backed by the local SQLite artifact
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "segmenter.airport-db", name = "enabled", havingValue = "true")
  public SqliteAirportRepository airportRepository(SegmenterProperties properties) {
    String path = properties.getAirportDb().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("segmenter.airport-db.enabled=true but segmenter.airport-db.path is empty");
    }
    return new SqliteAirportRepository(Path.of(path));
  }

  /**
   * Creates the route scope filter applied before writing partitions.
   *
   * @param properties segmenter configuration properties
   * @param airportRepository optional airport reference DB
   * @return configured filter
   */
  @Bean
  public RouteScopeFilter routeScopeFilter(SegmenterProperties properties, Optional<AirportRepository> airportRepository) {
    SegmenterProperties.Scope scope = properties.getScope();
    Set<String> airports = new HashSet<>(scope.getAirports());
    airportRepository.ifPresent(repo -> airports.addAll(repo.findIcaoCodesByCountry(scope.getIsoCountry())));

    if (scope.getMode() != ScopeMode.ALL && airports.isEmpty()) {
      log.warn("Route scope {} configured without any in-scope airport: no positions will be written", scope.getMode());
    }
    log.info("Route scope: mode={}, airports={}", scope.getMode(), airports.size());
    return new RouteScopeFilter(scope.getMode(), airports);
  }
}
