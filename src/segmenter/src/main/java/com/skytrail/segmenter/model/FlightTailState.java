package com.skytrail.segmenter.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of the flights still open at the end of a chunk.
 *
 * <p>Holds at most one tail per {@link OdKey}. This is the only state handed from one chunk to the
 * next.
 */
public final class FlightTailState {
  private static final Logger log = LoggerFactory.getLogger(FlightTailState.class);
  private static final FlightTailState EMPTY = new FlightTailState(Map.of());

  private final Map<OdKey, FlightTail> tails;

  private FlightTailState(Map<OdKey, FlightTail> tails) {
    this.tails = tails;
  }

  public static FlightTailState empty() {
    return EMPTY;
  }

  /**
   * Builds a state from explicit tails.
   *
   * @param tails open flight tails
   * @return snapshot keyed by OD key
   * @throws IllegalArgumentException when two tails share an OD key
   */
  public static FlightTailState of(Collection<FlightTail> tails) {
    Map<OdKey, FlightTail> byKey = new LinkedHashMap<>();
    for (FlightTail tail : tails) {
      FlightTail previous = byKey.putIfAbsent(tail.odKey(), tail);
      if (previous != null) {
        throw new IllegalArgumentException(
            "More than one open tail for " + tail.odKey() + ": flight ids " + previous.flightId() + " and " + tail.flightId());
      }
    }
    return byKey.isEmpty() ? EMPTY : new FlightTailState(Collections.unmodifiableMap(byKey));
  }

  /**
   * Captures the open tails of a finished chunk.
   *
   * <p>Takes the latest timestamp per (flight id, OD key) and keeps those no older than
   * {@code horizon} before the chunk's latest timestamp. When several flights of one OD key stay
   * open (for example after a gap split) only the most recent one is kept.
   *
   * @param positions labeled chunk output
   * @param horizon lookback horizon
   * @return tail state for the next chunk
   */
  public static FlightTailState capture(List<LabeledPosition> positions, Duration horizon) {
    if (positions.isEmpty()) {
      return EMPTY;
    }
    Instant chunkMax = Instant.MIN;
    Map<Long, FlightTail> byFlight = new HashMap<>();
    for (LabeledPosition labeled : positions) {
      PositionRecord position = labeled.position();
      if (position.timestamp().isAfter(chunkMax)) {
        chunkMax = position.timestamp();
      }
      // flight ids never span OD keys, so the flight id alone identifies the tail
      FlightTail current = byFlight.get(labeled.flightId());
      if (current == null || position.timestamp().isAfter(current.lastTimestamp())) {
        byFlight.put(labeled.flightId(), new FlightTail(labeled.flightId(), position.odKey(), position.timestamp()));
      }
    }

    Instant threshold = chunkMax.minus(horizon);
    Map<OdKey, FlightTail> byKey = new LinkedHashMap<>();
    int collapsed = 0;
    for (FlightTail tail : byFlight.values()) {
      if (tail.lastTimestamp().isBefore(threshold)) {
        continue;
      }
      FlightTail existing = byKey.get(tail.odKey());
      if (existing == null) {
        byKey.put(tail.odKey(), tail);
        continue;
      }
      collapsed++;
      if (isMoreRecent(tail, existing)) {
        byKey.put(tail.odKey(), tail);
      }
    }
    if (collapsed > 0) {
      log.debug("Collapsed {} older open tails sharing an OD key", collapsed);
    }
    return byKey.isEmpty() ? EMPTY : new FlightTailState(Collections.unmodifiableMap(byKey));
  }

  private static boolean isMoreRecent(FlightTail candidate, FlightTail existing) {
    int cmp = candidate.lastTimestamp().compareTo(existing.lastTimestamp());
    return cmp > 0 || (cmp == 0 && candidate.flightId() > existing.flightId());
  }

  public Optional<FlightTail> find(OdKey key) {
    return Optional.ofNullable(tails.get(key));
  }

  public Collection<FlightTail> tails() {
    return tails.values();
  }

  public int size() {
    return tails.size();
  }

  public boolean isEmpty() {
    return tails.isEmpty();
  }

  public OptionalLong maxFlightId() {
    return tails.values().stream().mapToLong(FlightTail::flightId).max();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FlightTailState other && tails.equals(other.tails);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tails);
  }

  @Override
  public String toString() {
    return "FlightTailState" + tails.values();
  }
}
