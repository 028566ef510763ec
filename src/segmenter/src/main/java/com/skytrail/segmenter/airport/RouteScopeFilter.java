package com.skytrail.segmenter.airport;

import com.skytrail.segmenter.config.ScopeMode;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps the positions whose route touches the in-scope airports.
 *
 * <p>Applied after segmentation and tail capture, so flight ids stay consistent for flights that
 * are never written.
 */
public class RouteScopeFilter {
  private final ScopeMode mode;
  private final Set<String> airports;

  /**
   * Creates a filter.
   *
   * @param mode endpoint rule
   * @param airports in-scope ICAO codes (case-insensitive)
   */
  public RouteScopeFilter(ScopeMode mode, Set<String> airports) {
    this.mode = mode;
    this.airports = airports.stream()
        .map(code -> code.trim().toUpperCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }

  public static RouteScopeFilter all() {
    return new RouteScopeFilter(ScopeMode.ALL, Set.of());
  }

  public ScopeMode mode() {
    return mode;
  }

  public Set<String> airports() {
    return airports;
  }

  public boolean accepts(PositionRecord position) {
    return switch (mode) {
      case ALL -> true;
      case ANY_ENDPOINT -> inScope(position.departureAirportIcao()) || inScope(position.arrivalAirportIcao());
      case BOTH_ENDPOINTS -> inScope(position.departureAirportIcao()) && inScope(position.arrivalAirportIcao());
    };
  }

  /**
   * Filters labeled positions.
   *
   * @param positions chunk output
   * @return in-scope positions, order preserved
   */
  public List<LabeledPosition> filter(List<LabeledPosition> positions) {
    if (mode == ScopeMode.ALL) {
      return positions;
    }
    return positions.stream()
        .filter(labeled -> accepts(labeled.position()))
        .collect(Collectors.toList());
  }

  private boolean inScope(String icao) {
    return icao != null && airports.contains(icao.toUpperCase(Locale.ROOT));
  }
}
