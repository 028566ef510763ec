package com.skytrail.segmenter.airport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Read-only SQLite implementation of {@link AirportRepository}.
 *
 * <p>Expects an {@code airports} table with at least {@code icao} and {@code iso_country} columns.
 * Results are cached per country for the lifetime of the repository.
 */
public class SqliteAirportRepository implements AirportRepository, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqliteAirportRepository.class);
  private static final String SELECT_BY_COUNTRY =
      "SELECT icao FROM airports WHERE UPPER(iso_country) = ? AND icao IS NOT NULL";

  private final Connection connection;
  private final PreparedStatement byCountry;
  private final Map<String, Set<String>> cache = new ConcurrentHashMap<>();

  /**
   * Creates a repository bound to a local SQLite file.
   *
   * @param sqlitePath path to the airport reference DB
   */
  public SqliteAirportRepository(Path sqlitePath) {
    if (!Files.exists(sqlitePath)) {
      throw new IllegalStateException("Airport DB not found at " + sqlitePath);
    }

    try {
      SQLiteConfig config = new SQLiteConfig();
      config.setReadOnly(true);
      this.connection = DriverManager.getConnection("jdbc:sqlite:" + sqlitePath.toAbsolutePath(), config.toProperties());
      this.byCountry = connection.prepareStatement(SELECT_BY_COUNTRY);
    } catch (SQLException ex) {
      throw new IllegalStateException("Failed to open airport SQLite DB", ex);
    }
  }

  /**
   * Looks up all airports of a country.
   *
   * <p>Lookup failures are not treated as misses: an empty result would silently drop every
   * flight from the output, so they surface as {@link IllegalStateException}.
   */
  @Override
  public Set<String> findIcaoCodesByCountry(String isoCountry) {
    if (isoCountry == null || isoCountry.isBlank()) {
      return Set.of();
    }
    String key = isoCountry.trim().toUpperCase(Locale.ROOT);
    return cache.computeIfAbsent(key, this::query);
  }

  private synchronized Set<String> query(String isoCountry) {
    Set<String> codes = new TreeSet<>();
    try {
      byCountry.setString(1, isoCountry);
      try (ResultSet rs = byCountry.executeQuery()) {
        while (rs.next()) {
          String icao = rs.getString("icao");
          if (icao != null && !icao.isBlank()) {
            codes.add(icao.trim().toUpperCase(Locale.ROOT));
          }
        }
      }
    } catch (SQLException ex) {
      throw new IllegalStateException("Airport lookup failed for country " + isoCountry, ex);
    }
    log.debug("Loaded {} airports for country {}", codes.size(), isoCountry);
    return Set.copyOf(codes);
  }

  @Override
  public void close() {
    try {
      byCountry.close();
    } catch (SQLException ex) {
      log.debug("Failed to close airport statement", ex);
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      log.debug("Failed to close airport DB connection", ex);
    }
  }
}
