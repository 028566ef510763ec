package com.skytrail.segmenter.io;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parses position timestamps.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>ADS-B export format {@code 2024-01-01 12:30:00.123 UTC} (fraction optional)</li>
 *   <li>ISO-8601 instants or offset date-times</li>
 *   <li>epoch seconds, or epoch milliseconds for values above 10^10</li>
 * </ul>
 */
public final class TimestampParser {
  private static final DateTimeFormatter ADS_B_UTC = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .appendLiteral(" UTC")
      .toFormatter();

  private TimestampParser() {}

  /**
   * Parses a textual timestamp.
   *
   * @param raw raw value
   * @return parsed instant
   * @throws IllegalArgumentException when the value matches no accepted form
   */
  public static Instant parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("timestamp is empty");
    }
    String value = raw.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      return fromEpoch(Long.parseLong(value));
    }
    if (value.endsWith(" UTC")) {
      try {
        return LocalDateTime.parse(value, ADS_B_UTC).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("unparsable timestamp: " + value, ex);
      }
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("unparsable timestamp: " + value, ex);
    }
  }

  /** Epoch seconds, or milliseconds for values above 10^10. */
  public static Instant fromEpoch(long epoch) {
    return epoch > 10_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
  }
}
