package com.skytrail.segmenter.airport;

import java.util.Set;

/** Repository contract for airport reference lookups. */
public interface AirportRepository {
  /**
   * Returns the ICAO codes of all airports in a country.
   *
   * @param isoCountry ISO 3166-1 alpha-2 country code (case-insensitive)
   * @return upper-case ICAO codes, empty when the country is unknown
   */
  Set<String> findIcaoCodesByCountry(String isoCountry);
}
