package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.OdKey;
import com.skytrail.segmenter.model.PositionRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups repaired positions into candidate flights: maximal runs of one OD key in
 * (aircraft, timestamp) order.
 */
public final class CandidateGrouper {

  private CandidateGrouper() {}

  /**
   * Assigns a dense, zero-based candidate id that increments whenever the OD key changes.
   *
   * @param sorted repaired positions sorted by aircraft and timestamp
   * @return positions tagged with their candidate id, in input order
   */
  public static List<CandidatePosition> group(List<PositionRecord> sorted) {
    List<CandidatePosition> out = new ArrayList<>(sorted.size());
    OdKey previous = null;
    int candidateId = -1;
    for (PositionRecord record : sorted) {
      OdKey key = record.odKey();
      if (!key.equals(previous)) {
        candidateId++;
        previous = key;
      }
      out.add(new CandidatePosition(record, candidateId));
    }
    return out;
  }
}
