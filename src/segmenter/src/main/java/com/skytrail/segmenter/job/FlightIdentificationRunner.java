package com.skytrail.segmenter.job;

import com.skytrail.segmenter.config.SegmenterProperties;
import com.skytrail.segmenter.io.InputFiles;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the segmentation once the Spring context is up.
 *
 * <p>Disabled with {@code segmenter.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "segmenter.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlightIdentificationRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(FlightIdentificationRunner.class);

  private final ChunkSequencer sequencer;
  private final SegmenterProperties properties;

  public FlightIdentificationRunner(ChunkSequencer sequencer, SegmenterProperties properties) {
    this.sequencer = sequencer;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    String inputDir = properties.getInput().getDir();
    String outputDir = properties.getOutput().getDir();
    if (inputDir == null || inputDir.isBlank()) {
      throw new IllegalStateException("segmenter.input.dir is empty");
    }
    if (outputDir == null || outputDir.isBlank()) {
      throw new IllegalStateException("segmenter.output.dir is empty");
    }

    List<Path> files = InputFiles.list(Path.of(inputDir), properties.getInput().getGlob());
    if (files.isEmpty()) {
      log.warn("No input files matching {} in {}", properties.getInput().getGlob(), inputDir);
      return;
    }
    RunSummary summary = sequencer.run(files, Path.of(outputDir));
    log.info(
        "Done! {} rows read, {} rows written, {} flights created; output written to {}",
        summary.rowsRead(),
        summary.rowsWritten(),
        summary.flightsCreated(),
        outputDir);
  }
}
