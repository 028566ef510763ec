package com.skytrail.segmenter.model;

/** Aircraft plus origin/destination pair: identifies one journey of one aircraft. */
public record OdKey(String icaoAddress, String departureAirportIcao, String arrivalAirportIcao) {

  @Override
  public String toString() {
    return icaoAddress + "_" + departureAirportIcao + "_" + arrivalAirportIcao;
  }
}
