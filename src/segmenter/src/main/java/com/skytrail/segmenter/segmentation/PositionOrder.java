package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.util.Comparator;

/** Sort orders shared by the segmentation stages. All of them sort by aircraft, then time. */
final class PositionOrder {
  static final Comparator<PositionRecord> RECORDS =
      Comparator.comparing(PositionRecord::icaoAddress).thenComparing(PositionRecord::timestamp);

  static final Comparator<LabeledPosition> LABELED =
      Comparator.comparing(LabeledPosition::position, RECORDS);

  static final Comparator<CandidatePosition> CANDIDATES =
      Comparator.comparing(CandidatePosition::position, RECORDS);

  private PositionOrder() {}
}
