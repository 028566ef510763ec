package com.skytrail.segmenter.job;

import com.skytrail.segmenter.airport.RouteScopeFilter;
import com.skytrail.segmenter.config.SegmenterProperties;
import com.skytrail.segmenter.io.DayPartitionWriter;
import com.skytrail.segmenter.io.InputFiles;
import com.skytrail.segmenter.io.PositionReader;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import com.skytrail.segmenter.segmentation.ChunkResult;
import com.skytrail.segmenter.segmentation.FlightSegmenter;
import com.skytrail.segmenter.segmentation.SegmentationStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the chunk loop of a segmentation run.
 *
 * <p>This component:
 * <ul>
 *   <li>reads input files in fixed-size chunks, strictly one chunk after the other</li>
 *   <li>hands each chunk with the previous {@link SequencerState} to the {@link FlightSegmenter}</li>
 *   <li>applies the route scope and appends the result to the day partitions</li>
 *   <li>emits low-cardinality row and flight metrics</li>
 * </ul>
 *
 * <p>A failing chunk aborts the run; partitions written by earlier chunks are kept.
 */
@Component
public class ChunkSequencer {
  private static final Logger log = LoggerFactory.getLogger(ChunkSequencer.class);

  private final PositionReader reader;
  private final FlightSegmenter segmenter;
  private final RouteScopeFilter scopeFilter;
  private final DayPartitionWriter writer;
  private final SegmenterProperties properties;
  private final Counter chunksCounter;
  private final Counter rowsReadCounter;
  private final Counter rowsWrittenCounter;
  private final Counter repairDroppedCounter;
  private final Counter noiseDroppedCounter;
  private final Counter scopeDroppedCounter;
  private final Counter flightsCreatedCounter;
  private final Counter flightsContinuedCounter;
  private final AtomicLong nextFlightIdGauge;
  private final AtomicInteger tailStateGauge;

  public ChunkSequencer(
      PositionReader reader,
      FlightSegmenter segmenter,
      RouteScopeFilter scopeFilter,
      DayPartitionWriter writer,
      SegmenterProperties properties,
      MeterRegistry meterRegistry) {
    this.reader = reader;
    this.segmenter = segmenter;
    this.scopeFilter = scopeFilter;
    this.writer = writer;
    this.properties = properties;
    this.chunksCounter = meterRegistry.counter("segmenter.chunks.processed");
    this.rowsReadCounter = meterRegistry.counter("segmenter.records.read");
    this.rowsWrittenCounter = meterRegistry.counter("segmenter.records.written");
    this.repairDroppedCounter = meterRegistry.counter("segmenter.records.dropped", "stage", "repair");
    this.noiseDroppedCounter = meterRegistry.counter("segmenter.records.dropped", "stage", "noise");
    this.scopeDroppedCounter = meterRegistry.counter("segmenter.records.dropped", "stage", "scope");
    this.flightsCreatedCounter = meterRegistry.counter("segmenter.flights.created");
    this.flightsContinuedCounter = meterRegistry.counter("segmenter.flights.continued");
    this.nextFlightIdGauge = meterRegistry.gauge("segmenter.flight_id.next", new AtomicLong(0));
    this.tailStateGauge = meterRegistry.gauge("segmenter.tail_state.size", new AtomicInteger(0));
  }

  /**
   * Runs the chunk loop over all input files.
   *
   * @param inputFiles input files in processing order
   * @param outputDir day partition directory
   * @return run totals
   */
  public RunSummary run(List<Path> inputFiles, Path outputDir) {
    long start = System.nanoTime();
    int chunkSize = properties.getChunkSizeFiles();
    log.info("Running flight identification for {} flight data files", inputFiles.size());
    log.info("Chunking {} files at a time", chunkSize);
    log.info("Output dir: {}", outputDir);

    SequencerState state = SequencerState.initial();
    long rowsRead = 0;
    long rowsWritten = 0;
    long flightsCreated = 0;
    List<List<Path>> chunks = InputFiles.chunk(inputFiles, chunkSize);
    for (List<Path> chunk : chunks) {
      log.info("Processing file chunk starting with {} ({} files)", chunk.get(0).getFileName(), chunk.size());
      ChunkOutcome outcome;
      try {
        outcome = processChunk(chunk, state, outputDir);
      } catch (RuntimeException ex) {
        log.error("Chunk starting with {} failed, aborting run", chunk.get(0).getFileName(), ex);
        throw ex;
      }
      state = outcome.state();
      rowsRead += outcome.result().stats().inputRows();
      rowsWritten += outcome.rowsWritten();
      flightsCreated += outcome.result().stats().newFlights();
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    log.info(
        "Flight identification complete in {}m {}s",
        elapsedMs / 60_000,
        String.format("%.1f", (elapsedMs % 60_000) / 1000.0));
    return new RunSummary(inputFiles.size(), chunks.size(), rowsRead, rowsWritten, flightsCreated, state.nextFlightId());
  }

  /**
   * Processes one chunk.
   *
   * @param files files of the chunk
   * @param state state left by the previous chunk
   * @param outputDir day partition directory
   * @return state for the next chunk with this chunk's result
   */
  ChunkOutcome processChunk(List<Path> files, SequencerState state, Path outputDir) {
    List<PositionRecord> records = reader.readAll(files);
    ChunkResult result = segmenter.segment(records, state.tails(), state.nextFlightId());
    SequencerState next = new SequencerState(result.tailState(), result.nextFlightId());

    List<LabeledPosition> inScope = scopeFilter.filter(result.positions());
    Map<Integer, Integer> perDay = writer.write(inScope, outputDir, properties.getOutput().getFilePrefix());

    SegmentationStats stats = result.stats();
    chunksCounter.increment();
    rowsReadCounter.increment(stats.inputRows());
    rowsWrittenCounter.increment(inScope.size());
    repairDroppedCounter.increment(stats.repairDroppedRows());
    noiseDroppedCounter.increment(stats.noiseDroppedRows());
    scopeDroppedCounter.increment(result.positions().size() - inScope.size());
    flightsCreatedCounter.increment(stats.newFlights());
    flightsContinuedCounter.increment(stats.continuedFlights());
    nextFlightIdGauge.set(next.nextFlightId());
    tailStateGauge.set(next.tails().size());

    log.info(
        "Chunk done: rows read={}, after repair={}, labeled={}, written={} to {} day partitions; "
            + "new flights={}, continued={}, next flight id={}, open tails={}",
        stats.inputRows(),
        stats.repairedRows(),
        stats.outputRows(),
        inScope.size(),
        perDay.size(),
        stats.newFlights(),
        stats.continuedFlights(),
        next.nextFlightId(),
        next.tails().size());
    return new ChunkOutcome(next, result, inScope.size());
  }

  /** Result of one chunk together with the state for the next one. */
  record ChunkOutcome(SequencerState state, ChunkResult result, int rowsWritten) {}
}
