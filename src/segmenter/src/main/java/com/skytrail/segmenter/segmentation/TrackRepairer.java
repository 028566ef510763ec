package com.skytrail.segmenter.segmentation;

import com.skytrail.segmenter.model.PositionRecord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs missing origin/destination airports per aircraft track within one chunk.
 *
 * <p>Per aircraft, in time order, a missing airport takes the nearest preceding known value and,
 * where none precedes it, the nearest following one. Aircraft with no known origin or no known
 * destination anywhere in the chunk are dropped.
 */
public final class TrackRepairer {
  private static final Logger log = LoggerFactory.getLogger(TrackRepairer.class);

  private TrackRepairer() {}

  /**
   * Repairs a chunk of positions.
   *
   * @param records chunk positions in any order
   * @return repaired positions sorted by aircraft and timestamp (stable for equal timestamps)
   */
  public static List<PositionRecord> repair(List<PositionRecord> records) {
    if (records.isEmpty()) {
      return List.of();
    }
    List<PositionRecord> sorted = new ArrayList<>(records);
    sorted.sort(PositionOrder.RECORDS);

    List<PositionRecord> repaired = new ArrayList<>(sorted.size());
    int droppedAircraft = 0;
    int start = 0;
    while (start < sorted.size()) {
      String icao = sorted.get(start).icaoAddress();
      int end = start;
      while (end < sorted.size() && sorted.get(end).icaoAddress().equals(icao)) {
        end++;
      }
      List<PositionRecord> track = sorted.subList(start, end);
      if (isRepairable(track)) {
        fillTrack(track, repaired);
      } else {
        droppedAircraft++;
      }
      start = end;
    }

    log.debug(
        "Track repair kept {} of {} rows, dropped {} aircraft without origin/destination",
        repaired.size(),
        records.size(),
        droppedAircraft);
    return repaired;
  }

  private static boolean isRepairable(List<PositionRecord> track) {
    boolean anyOrigin = false;
    boolean anyDestination = false;
    for (PositionRecord record : track) {
      anyOrigin |= record.hasOrigin();
      anyDestination |= record.hasDestination();
    }
    return anyOrigin && anyDestination;
  }

  private static void fillTrack(List<PositionRecord> track, List<PositionRecord> out) {
    String firstOrigin = null;
    String firstDestination = null;
    for (PositionRecord record : track) {
      if (firstOrigin == null) {
        firstOrigin = record.departureAirportIcao();
      }
      if (firstDestination == null) {
        firstDestination = record.arrivalAirportIcao();
      }
    }

    String lastOrigin = null;
    String lastDestination = null;
    for (PositionRecord record : track) {
      if (record.hasOrigin()) {
        lastOrigin = record.departureAirportIcao();
      }
      if (record.hasDestination()) {
        lastDestination = record.arrivalAirportIcao();
      }
      if (record.hasOrigin() && record.hasDestination()) {
        out.add(record);
        continue;
      }
      // forward fill first, backward fill only on the leading edge
      String origin = lastOrigin != null ? lastOrigin : firstOrigin;
      String destination = lastDestination != null ? lastDestination : firstDestination;
      out.add(record.withAirports(origin, destination));
    }
  }
}
