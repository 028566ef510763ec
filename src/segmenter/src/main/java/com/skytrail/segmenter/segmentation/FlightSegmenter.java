package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.FlightTailState;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flight segmentation engine for one chunk.
 *
 * <p>Pipeline: track repair, candidate grouping, continuity matching against the previous
 * chunk's open tails, noise filtering of new candidates, id offset, gap splitting of the merged
 * output and tail capture. The engine holds no state between calls: the tail state and the next
 * flight id are passed in and returned.
 */
public class FlightSegmenter {
  private static final Logger log = LoggerFactory.getLogger(FlightSegmenter.class);

  private final Duration hardGap;
  private final Duration lookbackHorizon;
  private final int minPoints;

  /**
   * Creates an engine.
   *
   * @param hardGap largest allowed gap between consecutive positions of a flight
   * @param lookbackHorizon how long a flight stays open after its last position
   * @param minPoints new candidates with this many positions or fewer are noise
   */
  public FlightSegmenter(Duration hardGap, Duration lookbackHorizon, int minPoints) {
    if (hardGap.isNegative() || hardGap.isZero()) {
      throw new IllegalArgumentException("hardGap must be positive");
    }
    if (lookbackHorizon.isNegative() || lookbackHorizon.isZero()) {
      throw new IllegalArgumentException("lookbackHorizon must be positive");
    }
    this.hardGap = hardGap;
    this.lookbackHorizon = lookbackHorizon;
    this.minPoints = minPoints;
  }

  /**
   * Continuations are accepted only within both thresholds, so a continued flight never needs a
   * split right at the chunk boundary.
   */
  public Duration continuationWindow() {
    return hardGap.compareTo(lookbackHorizon) < 0 ? hardGap : lookbackHorizon;
  }

  /**
   * Segments one chunk.
   *
   * @param chunk raw positions of the chunk, any order
   * @param previousTails open tails left by the previous chunk
   * @param nextFlightId lowest id available for flights created in this chunk
   * @return labeled positions, next tail state and next flight id
   */
  public ChunkResult segment(List<PositionRecord> chunk, FlightTailState previousTails, long nextFlightId) {
    if (nextFlightId < 0) {
      throw new IllegalArgumentException("nextFlightId must be >= 0");
    }
    if (chunk.isEmpty()) {
      return new ChunkResult(List.of(), FlightTailState.empty(), nextFlightId, new SegmentationStats(0, 0, 0, 0, 0, 0));
    }

    List<PositionRecord> repaired = TrackRepairer.repair(chunk);
    List<CandidatePosition> candidates = CandidateGrouper.group(repaired);
    MatchResult match =
        ContinuityMatcher.match(candidates, previousTails, lookbackHorizon, continuationWindow(), minPoints);
    List<CandidatePosition> kept = NoiseFilter.filter(match.fresh(), minPoints);

    List<LabeledPosition> merged = new ArrayList<>(match.continued().size() + kept.size());
    merged.addAll(match.continued());
    for (CandidatePosition candidate : kept) {
      merged.add(new LabeledPosition(candidate.position(), candidate.candidateId() + nextFlightId));
    }
    List<LabeledPosition> labeled = GapSplitter.split(merged, hardGap, nextFlightId);

    long maxFlightId = -1;
    Set<Long> newFlightIds = new HashSet<>();
    for (LabeledPosition position : labeled) {
      maxFlightId = Math.max(maxFlightId, position.flightId());
      if (position.flightId() >= nextFlightId) {
        newFlightIds.add(position.flightId());
      }
    }
    long advanced = Math.max(nextFlightId, maxFlightId + 1);
    FlightTailState tails = FlightTailState.capture(labeled, lookbackHorizon);

    SegmentationStats stats = new SegmentationStats(
        chunk.size(),
        repaired.size(),
        match.noiseRows() + match.fresh().size() - kept.size(),
        match.continuedFlights(),
        newFlightIds.size(),
        labeled.size());
    if (labeled.isEmpty()) {
      log.debug("Chunk of {} rows produced no flights", chunk.size());
    } else {
      log.debug(
          "Chunk flight ids span {}..{}, {} open tails carried forward",
          labeled.stream().mapToLong(LabeledPosition::flightId).min().orElse(-1),
          maxFlightId,
          tails.size());
    }
    return new ChunkResult(labeled, tails, advanced, stats);
  }
}
