package com.skytrail.segmenter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the flight segmenter.
 *
 * <p>The segmenter reads chunked ADS-B position files, assigns globally unique flight ids and
 * writes day-partitioned output. The run itself is driven by
 * {@link com.skytrail.segmenter.job.FlightIdentificationRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SegmenterApplication {
  /**
   * Starts the segmenter application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(SegmenterApplication.class, args)));
  }
}
