package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.FlightTail;
import com.skytrail.segmenter.model.FlightTailState;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.OdKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a chunk's candidate flights into continuations of flights still open at the end of the
 * previous chunk and new flights.
 *
 * <p>For each OD key only the candidate holding the key's earliest record in the chunk can
 * continue a flight, and only when:
 * <ul>
 *   <li>that earliest record is within the lookback horizon of the chunk's earliest record</li>
 *   <li>the previous chunk left an open tail for the same OD key</li>
 *   <li>the record is at most {@code continuationWindow} away from the tail's last record, in
 *   either direction</li>
 * </ul>
 *
 * <p>A continued flight also takes later runs of the same OD key when everything between them is
 * candidates of at most {@code minPoints} rows. Those in-between rows are dropped as noise, as
 * {@link NoiseFilter} does inside a chunk, so the result does not depend on where a chunk ends.
 */
public final class ContinuityMatcher {
  private static final Logger log = LoggerFactory.getLogger(ContinuityMatcher.class);

  private ContinuityMatcher() {}

  /**
   * Matches candidates against the open tails of the previous chunk.
   *
   * @param candidates grouped chunk positions in (aircraft, timestamp) order
   * @param tails open tails of the previous chunk
   * @param lookbackHorizon how far after the chunk start a continuation may begin
   * @param continuationWindow max distance in time between a tail's last record and its
   *     continuation
   * @param minPoints candidates with this many positions or fewer are noise
   * @return continued positions relabeled with the prior flight id, and the remaining candidates
   */
  public static MatchResult match(
      List<CandidatePosition> candidates,
      FlightTailState tails,
      Duration lookbackHorizon,
      Duration continuationWindow,
      int minPoints) {
    if (candidates.isEmpty() || tails.isEmpty()) {
      return new MatchResult(List.of(), candidates, 0, 0);
    }

    Instant chunkEarliest = candidates.get(0).position().timestamp();
    Map<OdKey, CandidatePosition> earliestByKey = new LinkedHashMap<>();
    for (CandidatePosition candidate : candidates) {
      Instant ts = candidate.position().timestamp();
      if (ts.isBefore(chunkEarliest)) {
        chunkEarliest = ts;
      }
      CandidatePosition earliest = earliestByKey.get(candidate.odKey());
      if (earliest == null || ts.isBefore(earliest.position().timestamp())) {
        earliestByKey.put(candidate.odKey(), candidate);
      }
    }

    Instant horizonEnd = chunkEarliest.plus(lookbackHorizon);
    Map<Integer, Long> continuedCandidates = new HashMap<>();
    for (Map.Entry<OdKey, CandidatePosition> entry : earliestByKey.entrySet()) {
      Instant first = entry.getValue().position().timestamp();
      if (first.isAfter(horizonEnd)) {
        continue;
      }
      Optional<FlightTail> tail = tails.find(entry.getKey());
      if (tail.isEmpty()) {
        continue;
      }
      Duration delta = Duration.between(tail.get().lastTimestamp(), first);
      if (delta.abs().compareTo(continuationWindow) <= 0) {
        continuedCandidates.put(entry.getValue().candidateId(), tail.get().flightId());
      }
    }

    if (continuedCandidates.isEmpty()) {
      return new MatchResult(List.of(), candidates, 0, 0);
    }

    Map<Integer, OdKey> keyById = new HashMap<>();
    Map<Integer, Integer> countById = new HashMap<>();
    int maxCandidateId = -1;
    for (CandidatePosition candidate : candidates) {
      keyById.putIfAbsent(candidate.candidateId(), candidate.odKey());
      countById.merge(candidate.candidateId(), 1, Integer::sum);
      maxCandidateId = Math.max(maxCandidateId, candidate.candidateId());
    }
    Map<Integer, Long> labels = new HashMap<>(continuedCandidates);
    Set<Integer> noise = new HashSet<>();
    for (Map.Entry<Integer, Long> entry : continuedCandidates.entrySet()) {
      OdKey key = keyById.get(entry.getKey());
      List<Integer> between = new ArrayList<>();
      for (int id = entry.getKey() + 1; id <= maxCandidateId; id++) {
        OdKey other = keyById.get(id);
        if (other == null
            || !other.icaoAddress().equals(key.icaoAddress())
            || continuedCandidates.containsKey(id)) {
          break;
        }
        if (other.equals(key)) {
          labels.put(id, entry.getValue());
          noise.addAll(between);
          between.clear();
        } else if (countById.get(id) <= minPoints) {
          between.add(id);
        } else {
          break;
        }
      }
    }

    List<LabeledPosition> continued = new ArrayList<>();
    List<CandidatePosition> fresh = new ArrayList<>();
    int noiseRows = 0;
    for (CandidatePosition candidate : candidates) {
      Long flightId = labels.get(candidate.candidateId());
      if (flightId != null) {
        continued.add(new LabeledPosition(candidate.position(), flightId));
      } else if (noise.contains(candidate.candidateId())) {
        noiseRows++;
      } else {
        fresh.add(candidate);
      }
    }
    log.debug(
        "Continued {} flights from previous chunk ({} rows, {} noise rows dropped), {} rows left for new flights",
        continuedCandidates.size(),
        continued.size(),
        noiseRows,
        fresh.size());
    return new MatchResult(continued, fresh, continuedCandidates.size(), noiseRows);
  }
}
