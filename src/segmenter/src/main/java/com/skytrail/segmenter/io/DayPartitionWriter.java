package com.skytrail.segmenter.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes labeled positions to one JSON Lines file per calendar day.
 *
 * <p>The day is the UTC ordinal day of year of the position timestamp, zero padded to three
 * digits: {@code <prefix>032.jsonl}. A partition that already exists is read, merged with the new
 * rows and rewritten through a temporary file. Rows are never deduplicated.
 */
@Component
public class DayPartitionWriter {
  private static final Logger log = LoggerFactory.getLogger(DayPartitionWriter.class);
  public static final String FLIGHT_ID = "flight_id";
  public static final String EXTENSION = ".jsonl";

  private final ObjectMapper objectMapper;

  public DayPartitionWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Appends positions to their day partitions.
   *
   * @param positions labeled positions
   * @param outputDir partition directory, created when missing
   * @param filePrefix partition file name prefix
   * @return rows written per ordinal day
   * @throws OutputWriteException when a partition cannot be read or written
   */
  public Map<Integer, Integer> write(List<LabeledPosition> positions, Path outputDir, String filePrefix) {
    Map<Integer, List<String>> byDay = new TreeMap<>();
    for (LabeledPosition labeled : positions) {
      int day = labeled.position().timestamp().atZone(ZoneOffset.UTC).getDayOfYear();
      byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(toJson(labeled));
    }

    Map<Integer, Integer> written = new TreeMap<>();
    try {
      Files.createDirectories(outputDir);
    } catch (IOException ex) {
      throw new OutputWriteException("Failed to create output dir " + outputDir, ex);
    }
    for (Map.Entry<Integer, List<String>> entry : byDay.entrySet()) {
      Path file = partitionFile(outputDir, filePrefix, entry.getKey());
      appendPartition(file, entry.getValue());
      written.put(entry.getKey(), entry.getValue().size());
    }
    return written;
  }

  /** File name of the partition holding ordinal day {@code dayOfYear}. */
  public static Path partitionFile(Path outputDir, String filePrefix, int dayOfYear) {
    return outputDir.resolve(filePrefix + String.format("%03d", dayOfYear) + EXTENSION);
  }

  private void appendPartition(Path file, List<String> lines) {
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    int existing = 0;
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        if (Files.exists(file)) {
          existing = copyRows(file, writer);
        }
        for (String line : lines) {
          writer.write(line);
          writer.newLine();
        }
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      OutputWriteException failure = new OutputWriteException("Failed to write partition " + file, ex);
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }
    log.debug("Partition {}: {} existing rows, {} appended", file.getFileName(), existing, lines.size());
  }

  private static int copyRows(Path file, BufferedWriter writer) throws IOException {
    int rows = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) {
          writer.write(line);
          writer.newLine();
          rows++;
        }
      }
    }
    return rows;
  }

  private String toJson(LabeledPosition labeled) {
    PositionRecord position = labeled.position();
    ObjectNode node = position.attributes().deepCopy();
    node.put(PositionReader.TIMESTAMP, position.timestamp().toString());
    node.put(PositionReader.ICAO_ADDRESS, position.icaoAddress());
    node.put(PositionReader.LATITUDE, position.latitude());
    node.put(PositionReader.LONGITUDE, position.longitude());
    node.put(PositionReader.DEPARTURE_AIRPORT, position.departureAirportIcao());
    node.put(PositionReader.ARRIVAL_AIRPORT, position.arrivalAirportIcao());
    node.put(FLIGHT_ID, labeled.flightId());
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new OutputWriteException("Failed to serialize position of " + position.icaoAddress(), ex);
    }
  }
}
