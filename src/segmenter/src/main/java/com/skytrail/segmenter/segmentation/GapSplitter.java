package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.LabeledPosition;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits flights at time gaps longer than the hard gap.
 *
 * <p>A position starts a new segment when it is more than {@code hardGap} after the previous
 * position of the same flight. New flights (ids from {@code firstNewFlightId} on) are renumbered
 * by adding the running count of split points seen so far in the chunk; since their base ids are
 * non-decreasing in (aircraft, timestamp) order the result stays unique. Continued flights keep
 * their id for the first segment and get fresh ids after the highest new id for the rest.
 */
public final class GapSplitter {
  private static final Logger log = LoggerFactory.getLogger(GapSplitter.class);

  private GapSplitter() {}

  /**
   * Splits the merged continued and new positions of one chunk.
   *
   * @param positions labeled positions, any order
   * @param hardGap largest allowed gap between consecutive positions of a flight
   * @param firstNewFlightId lowest id a flight created in this chunk can carry
   * @return positions sorted by aircraft and timestamp with their final flight ids
   */
  public static List<LabeledPosition> split(List<LabeledPosition> positions, Duration hardGap, long firstNewFlightId) {
    if (positions.isEmpty()) {
      return List.of();
    }
    List<LabeledPosition> sorted = new ArrayList<>(positions);
    sorted.sort(PositionOrder.LABELED);

    int n = sorted.size();
    boolean[] gapBefore = new boolean[n];
    Map<Long, Instant> lastSeen = new HashMap<>();
    int splits = 0;
    for (int i = 0; i < n; i++) {
      LabeledPosition labeled = sorted.get(i);
      Instant ts = labeled.position().timestamp();
      Instant previous = lastSeen.put(labeled.flightId(), ts);
      if (previous != null && Duration.between(previous, ts).compareTo(hardGap) > 0) {
        gapBefore[i] = true;
        splits++;
      }
    }
    if (splits == 0) {
      return sorted;
    }

    long[] ids = new long[n];
    long increment = 0;
    long maxNewId = firstNewFlightId - 1;
    for (int i = 0; i < n; i++) {
      long base = sorted.get(i).flightId();
      if (base < firstNewFlightId) {
        continue;
      }
      if (gapBefore[i]) {
        increment++;
      }
      ids[i] = base + increment;
      maxNewId = Math.max(maxNewId, ids[i]);
    }

    long nextFresh = maxNewId + 1;
    Map<Long, Long> continuedSegment = new HashMap<>();
    for (int i = 0; i < n; i++) {
      long base = sorted.get(i).flightId();
      if (base >= firstNewFlightId) {
        continue;
      }
      if (gapBefore[i]) {
        continuedSegment.put(base, nextFresh++);
      }
      ids[i] = continuedSegment.getOrDefault(base, base);
    }

    List<LabeledPosition> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(sorted.get(i).withFlightId(ids[i]));
    }
    log.debug("Split {} flights at gaps longer than {}", splits, hardGap);
    return out;
  }
}
