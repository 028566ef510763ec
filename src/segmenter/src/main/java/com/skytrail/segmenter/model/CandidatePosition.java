package com.skytrail.segmenter.model;

/** A position tagged with its chunk-local candidate flight id. */
public record CandidatePosition(PositionRecord position, int candidateId) {

  public OdKey odKey() {
    return position.odKey();
  }
}
