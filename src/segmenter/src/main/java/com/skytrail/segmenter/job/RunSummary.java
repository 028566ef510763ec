package com.skytrail.segmenter.job;

/** Totals of one segmentation run. */
public record RunSummary(
    int files,
    int chunks,
    long rowsRead,
    long rowsWritten,
    long flightsCreated,
    long nextFlightId) {}
