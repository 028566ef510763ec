package com.skytrail.segmenter.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;

/**
 * One ADS-B position report for one aircraft at one instant.
 *
 * <p>{@code attributes} holds the full source object, including passthrough fields the segmenter
 * never looks at. It is owned by the record and must not be mutated after construction.
 */
public record PositionRecord(
    String icaoAddress,
    Instant timestamp,
    Double latitude,
    Double longitude,
    String departureAirportIcao,
    String arrivalAirportIcao,
    ObjectNode attributes) {

  public PositionRecord {
    Objects.requireNonNull(icaoAddress, "icaoAddress");
    Objects.requireNonNull(timestamp, "timestamp");
    if (attributes == null) {
      attributes = JsonNodeFactory.instance.objectNode();
    }
  }

  public boolean hasOrigin() {
    return departureAirportIcao != null;
  }

  public boolean hasDestination() {
    return arrivalAirportIcao != null;
  }

  /** Returns a copy carrying the given origin and destination. */
  public PositionRecord withAirports(String departure, String arrival) {
    return new PositionRecord(icaoAddress, timestamp, latitude, longitude, departure, arrival, attributes);
  }

  /**
   * Returns the journey key of this record.
   *
   * @throws IllegalStateException when origin or destination is still missing
   */
  public OdKey odKey() {
    if (departureAirportIcao == null || arrivalAirportIcao == null) {
      throw new IllegalStateException("OD key requires origin and destination for " + icaoAddress + " at " + timestamp);
    }
    return new OdKey(icaoAddress, departureAirportIcao, arrivalAirportIcao);
  }
}
