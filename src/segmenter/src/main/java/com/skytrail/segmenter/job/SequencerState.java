package com.skytrail.segmenter.job;

import com.skytrail.segmenter.model.FlightTailState;

/**
 * State handed from one chunk to the next: the open flight tails and the lowest unused flight
 * id.
 */
public record SequencerState(FlightTailState tails, long nextFlightId) {

  public static SequencerState initial() {
    return new SequencerState(FlightTailState.empty(), 0L);
  }
}
