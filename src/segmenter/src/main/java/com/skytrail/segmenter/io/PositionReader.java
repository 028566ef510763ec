package com.skytrail.segmenter.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skytrail.segmenter.model.PositionRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads ADS-B position files in JSON Lines format.
 *
 * <p>Every object must carry the columns in {@link #REQUIRED_COLUMNS}; airport values may be null
 * or blank. All other attributes are kept on the record and written back unchanged.
 */
@Component
public class PositionReader {
  private static final Logger log = LoggerFactory.getLogger(PositionReader.class);

  public static final String TIMESTAMP = "timestamp";
  public static final String ICAO_ADDRESS = "icao_address";
  public static final String LATITUDE = "latitude";
  public static final String LONGITUDE = "longitude";
  public static final String DEPARTURE_AIRPORT = "departure_airport_icao";
  public static final String ARRIVAL_AIRPORT = "arrival_airport_icao";
  public static final List<String> REQUIRED_COLUMNS =
      List.of(TIMESTAMP, ICAO_ADDRESS, LATITUDE, LONGITUDE, DEPARTURE_AIRPORT, ARRIVAL_AIRPORT);

  private final ObjectMapper objectMapper;

  public PositionReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Reads and concatenates several files in the given order.
   *
   * @param files input files
   * @return all positions, file order preserved
   */
  public List<PositionRecord> readAll(List<Path> files) {
    List<PositionRecord> records = new ArrayList<>();
    for (Path file : files) {
      records.addAll(read(file));
    }
    return records;
  }

  /**
   * Reads one file.
   *
   * @param file JSON Lines file
   * @return positions in file order
   * @throws SchemaException when a line is not a valid position object
   * @throws UncheckedIOException when the file cannot be read
   */
  public List<PositionRecord> read(Path file) {
    List<PositionRecord> records = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        records.add(parseLine(line, file, lineNumber));
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read " + file, ex);
    }
    log.debug("Read {} rows from {}", records.size(), file.getFileName());
    return records;
  }

  private PositionRecord parseLine(String line, Path file, int lineNumber) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException ex) {
      throw new SchemaException(location(file, lineNumber) + ": not valid JSON", ex);
    }
    if (!(node instanceof ObjectNode object)) {
      throw new SchemaException(location(file, lineNumber) + ": expected a JSON object");
    }
    for (String column : REQUIRED_COLUMNS) {
      if (!object.has(column)) {
        throw new SchemaException(location(file, lineNumber) + ": missing required column '" + column + "'");
      }
    }

    String icao = textOrNull(object.get(ICAO_ADDRESS));
    if (icao == null) {
      throw new SchemaException(location(file, lineNumber) + ": empty " + ICAO_ADDRESS);
    }
    return new PositionRecord(
        icao,
        parseTimestamp(object.get(TIMESTAMP), file, lineNumber),
        doubleOrNull(object.get(LATITUDE), LATITUDE, file, lineNumber),
        doubleOrNull(object.get(LONGITUDE), LONGITUDE, file, lineNumber),
        textOrNull(object.get(DEPARTURE_AIRPORT)),
        textOrNull(object.get(ARRIVAL_AIRPORT)),
        object);
  }

  private static Instant parseTimestamp(JsonNode node, Path file, int lineNumber) {
    try {
      if (node.isIntegralNumber()) {
        return TimestampParser.fromEpoch(node.asLong());
      }
      if (node.isTextual()) {
        return TimestampParser.parse(node.asText());
      }
    } catch (IllegalArgumentException ex) {
      throw new SchemaException(location(file, lineNumber) + ": " + ex.getMessage(), ex);
    }
    throw new SchemaException(location(file, lineNumber) + ": timestamp must be text or epoch seconds");
  }

  private static Double doubleOrNull(JsonNode node, String column, Path file, int lineNumber) {
    if (node.isNull()) {
      return null;
    }
    if (!node.isNumber()) {
      throw new SchemaException(location(file, lineNumber) + ": " + column + " must be numeric");
    }
    return node.asDouble();
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private static String location(Path file, int lineNumber) {
    return file.getFileName() + ":" + lineNumber;
  }
}
