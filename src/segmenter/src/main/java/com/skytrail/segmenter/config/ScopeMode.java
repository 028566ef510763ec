package com.skytrail.segmenter.config;

/** Which endpoints of a flight must be in-scope airports for its records to be written. */
public enum ScopeMode {
  /** Every record is written. */
  ALL,
  /** Departure or arrival airport is in scope. */
  ANY_ENDPOINT,
  /** Departure and arrival airports are both in scope (regional flights). */
  BOTH_ENDPOINTS
}
