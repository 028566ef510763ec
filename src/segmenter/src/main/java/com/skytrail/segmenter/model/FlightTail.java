package com.skytrail.segmenter.model;

import java.time.Instant;

/** Last known timestamp of a flight that may still continue in the next chunk. */
public record FlightTail(long flightId, OdKey odKey, Instant lastTimestamp) {}
