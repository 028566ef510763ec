package com.skytrail.segmenter.io;

import static com.skytrail.segmenter.TestPositions.position;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DayPartitionWriterTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DayPartitionWriter writer = new DayPartitionWriter(objectMapper);

  @TempDir
  Path dir;

  @Test
  void writesOneFilePerOrdinalDay() throws Exception {
    List<LabeledPosition> positions = List.of(
        labeled("2024-01-01T23:59:00Z", 0),
        labeled("2024-01-02T00:01:00Z", 0),
        labeled("2024-02-01T12:00:00Z", 1));

    Map<Integer, Integer> written = writer.write(positions, dir.resolve("out"), "flights_day_");

    assertThat(written).containsExactly(Map.entry(1, 1), Map.entry(2, 1), Map.entry(32, 1));
    assertThat(dir.resolve("out/flights_day_001.jsonl")).exists();
    assertThat(dir.resolve("out/flights_day_002.jsonl")).exists();
    assertThat(dir.resolve("out/flights_day_032.jsonl")).exists();
    assertThat(Files.list(dir.resolve("out"))).hasSize(3);
  }

  @Test
  void existingPartitionIsAppendedNotReplaced() throws Exception {
    writer.write(List.of(labeled("2024-01-01T10:00:00Z", 0)), dir, "flights_day_");
    writer.write(List.of(labeled("2024-01-01T11:00:00Z", 1), labeled("2024-01-01T11:00:00Z", 1)), dir, "flights_day_");

    List<JsonNode> rows = readRows(DayPartitionWriter.partitionFile(dir, "flights_day_", 1));

    assertThat(rows).extracting(r -> r.get("flight_id").asLong()).containsExactly(0L, 1L, 1L);
    assertThat(dir.resolve("flights_day_001.jsonl.tmp")).doesNotExist();
  }

  @Test
  void rowsCarryRepairedAirportsFlightIdAndPassthroughFields() throws Exception {
    ObjectNode source = objectMapper.createObjectNode();
    source.put("callsign", "BAW1432");
    source.put("departure_airport_icao", (String) null);
    PositionRecord record = new PositionRecord(
        "400F0E", Instant.parse("2024-01-01T08:00:00Z"), 51.47, -0.45, "EGLL", "EGPH", source);

    writer.write(List.of(new LabeledPosition(record, 7)), dir, "flights_day_");

    JsonNode row = readRows(DayPartitionWriter.partitionFile(dir, "flights_day_", 1)).get(0);
    assertThat(row.get("callsign").asText()).isEqualTo("BAW1432");
    assertThat(row.get("departure_airport_icao").asText()).isEqualTo("EGLL");
    assertThat(row.get("timestamp").asText()).isEqualTo("2024-01-01T08:00:00Z");
    assertThat(row.get("flight_id").asLong()).isEqualTo(7L);
    assertThat(source.get("departure_airport_icao").isNull()).isTrue();
  }

  @Test
  void failedRewriteLeavesNoTempFileAndKeepsPartition() throws Exception {
    Path partition = DayPartitionWriter.partitionFile(dir, "flights_day_", 1);
    byte[] corrupt = {'{', '"', (byte) 0xC3, (byte) 0x28, '"', '}', '\n'};
    Files.write(partition, corrupt);

    assertThatThrownBy(() -> writer.write(List.of(labeled("2024-01-01T10:00:00Z", 0)), dir, "flights_day_"))
        .isInstanceOf(OutputWriteException.class)
        .hasMessageContaining("flights_day_001.jsonl");

    assertThat(dir.resolve("flights_day_001.jsonl.tmp")).doesNotExist();
    assertThat(Files.readAllBytes(partition)).isEqualTo(corrupt);
  }

  private static LabeledPosition labeled(String timestamp, long flightId) {
    return new LabeledPosition(position("400F0E", "EGLL", "EGPH", Instant.parse(timestamp)), flightId);
  }

  private List<JsonNode> readRows(Path file) throws Exception {
    return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
        .map(line -> {
          try {
            return objectMapper.readTree(line);
          } catch (Exception ex) {
            throw new IllegalStateException(ex);
          }
        })
        .toList();
  }
}
