package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.OdKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops candidate flights made of too few positions and renumbers the survivors densely.
 *
 * <p>Short candidates are usually a spurious origin/destination switch in the middle of a real
 * flight. Two surviving runs of the same OD key that were separated only by dropped candidates
 * are therefore renumbered as one candidate.
 */
public final class NoiseFilter {
  private static final Logger log = LoggerFactory.getLogger(NoiseFilter.class);

  private NoiseFilter() {}

  /**
   * Filters and renumbers new-flight candidates.
   *
   * @param fresh candidates in (aircraft, timestamp) order
   * @param minPoints candidates with this many positions or fewer are dropped
   * @return surviving positions with zero-based, gap-free candidate ids, in input order
   */
  public static List<CandidatePosition> filter(List<CandidatePosition> fresh, int minPoints) {
    if (fresh.isEmpty()) {
      return List.of();
    }
    Map<Integer, Integer> counts = new HashMap<>();
    for (CandidatePosition candidate : fresh) {
      counts.merge(candidate.candidateId(), 1, Integer::sum);
    }
    Set<Integer> dropped = new HashSet<>();
    counts.forEach((candidateId, count) -> {
      if (count <= minPoints) {
        dropped.add(candidateId);
      }
    });

    List<CandidatePosition> out = new ArrayList<>(fresh.size());
    int denseId = -1;
    int previousCandidate = -1;
    OdKey previousKey = null;
    for (CandidatePosition candidate : fresh) {
      if (dropped.contains(candidate.candidateId())) {
        continue;
      }
      if (candidate.candidateId() != previousCandidate) {
        OdKey key = candidate.odKey();
        if (!key.equals(previousKey) || !onlyDroppedBetween(previousCandidate, candidate.candidateId(), dropped)) {
          denseId++;
        }
        previousCandidate = candidate.candidateId();
        previousKey = key;
      }
      out.add(new CandidatePosition(candidate.position(), denseId));
    }

    log.debug(
        "Noise filter kept {} of {} candidate flights ({} of {} rows)",
        denseId + 1,
        counts.size(),
        out.size(),
        fresh.size());
    return out;
  }

  private static boolean onlyDroppedBetween(int fromExclusive, int toExclusive, Set<Integer> dropped) {
    if (fromExclusive < 0) {
      return false;
    }
    for (int id = fromExclusive + 1; id < toExclusive; id++) {
      // ids missing from the fresh stream belong to continued flights and break the run
      if (!dropped.contains(id)) {
        return false;
      }
    }
    return true;
  }
}
