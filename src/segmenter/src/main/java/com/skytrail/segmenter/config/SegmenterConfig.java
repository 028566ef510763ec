package com.skytrail.segmenter.config;

import com.skytrail.segmenter.segmentation.FlightSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SegmenterConfig {
  private static final Logger log = LoggerFactory.getLogger(SegmenterConfig.class);

  @Bean
  public FlightSegmenter flightSegmenter(SegmenterProperties properties) {
    properties.validate();
    SegmenterProperties.Segmentation segmentation = properties.getSegmentation();
    log.info(
        "Segmentation thresholds: hardGapHours={}, lookbackHorizonHours={}, minConsecutivePoints={}",
        segmentation.getHardGapHours(),
        segmentation.getLookbackHorizonHours(),
        segmentation.getMinConsecutivePoints());
    // Reserved for in-air consistency checks, not consulted by the engine.
    log.info(
        "Reserved thresholds: softGapMinutes={}, longGroundGapMinutes={}, maxJumpKm={}, sameHeadingDegrees={}",
        segmentation.getSoftGapMinutes(),
        segmentation.getLongGroundGapMinutes(),
        segmentation.getMaxJumpKm(),
        segmentation.getSameHeadingDegrees());
    return new FlightSegmenter(
        segmentation.hardGap(),
        segmentation.lookbackHorizon(),
        segmentation.getMinConsecutivePoints());
  }
}
