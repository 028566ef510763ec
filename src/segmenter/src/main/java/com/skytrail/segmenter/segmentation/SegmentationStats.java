package com.skytrail.segmenter.segmentation;

/** Row and flight counts of one segmented chunk. */
public record SegmentationStats(
    int inputRows,
    int repairedRows,
    int noiseDroppedRows,
    int continuedFlights,
    int newFlights,
    int outputRows) {

  public int repairDroppedRows() {
    return inputRows - repairedRows;
  }
}
