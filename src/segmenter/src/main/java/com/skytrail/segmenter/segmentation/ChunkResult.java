package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.FlightTailState;
import com.skytrail.segmenter.model.LabeledPosition;
import java.util.List;

/**
 * Output of one {@link FlightSegmenter#segment} call.
 *
 * @param positions labeled positions sorted by aircraft and timestamp
 * @param tailState open tails to hand to the next chunk
 * @param nextFlightId lowest flight id the next chunk may assign
 * @param stats row and flight counts for diagnostics
 */
public record ChunkResult(
    List<LabeledPosition> positions,
    FlightTailState tailState,
    long nextFlightId,
    SegmentationStats stats) {}
