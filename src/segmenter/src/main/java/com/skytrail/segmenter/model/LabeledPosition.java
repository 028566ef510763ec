package com.skytrail.segmenter.model;

/** A position tagged with its global flight id. */
public record LabeledPosition(PositionRecord position, long flightId) {

  public LabeledPosition withFlightId(long newFlightId) {
    return new LabeledPosition(position, newFlightId);
  }
}
