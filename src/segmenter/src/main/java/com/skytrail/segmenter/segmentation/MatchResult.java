package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.LabeledPosition;
import java.util.List;

/**
 * Output of {@link ContinuityMatcher}: positions continuing a flight from the previous chunk and
 * positions of candidates that start new flights. {@code noiseRows} counts rows of short
 * candidates dropped between runs of a continued flight.
 */
public record MatchResult(
    List<LabeledPosition> continued,
    List<CandidatePosition> fresh,
    int continuedFlights,
    int noiseRows) {}
