package com.skytrail.segmenter.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the segmenter.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code segmenter.*} prefix.
 */
@ConfigurationProperties(prefix = "segmenter")
public class SegmenterProperties {
  private final Input input = new Input();
  private final Output output = new Output();
  private final Segmentation segmentation = new Segmentation();
  private final Scope scope = new Scope();
  private final AirportDb airportDb = new AirportDb();
  private int chunkSizeFiles = 5;

  public Input getInput() {
    return input;
  }

  public Output getOutput() {
    return output;
  }

  public Segmentation getSegmentation() {
    return segmentation;
  }

  public Scope getScope() {
    return scope;
  }

  public AirportDb getAirportDb() {
    return airportDb;
  }

  public int getChunkSizeFiles() {
    return chunkSizeFiles;
  }

  public void setChunkSizeFiles(int chunkSizeFiles) {
    this.chunkSizeFiles = chunkSizeFiles;
  }

  /** Location of the raw position files. */
  public static class Input {
    private String dir = "";
    private String glob = "*.jsonl";

    public String getDir() {
      return dir;
    }

    public void setDir(String dir) {
      this.dir = dir;
    }

    public String getGlob() {
      return glob;
    }

    public void setGlob(String glob) {
      this.glob = glob;
    }
  }

  /** Location and naming of the day partitions. */
  public static class Output {
    private String dir = "";
    private String filePrefix = "flights_day_";

    public String getDir() {
      return dir;
    }

    public void setDir(String dir) {
      this.dir = dir;
    }

    public String getFilePrefix() {
      return filePrefix;
    }

    public void setFilePrefix(String filePrefix) {
      this.filePrefix = filePrefix;
    }
  }

  /**
   * Flight segmentation thresholds.
   *
   * <p>Only the hard gap, the minimum point count and the lookback horizon drive segmentation. The
   * soft gap, long ground gap, max jump and same heading values are reserved for in-air
   * consistency checks and are only reported at startup.
   */
  public static class Segmentation {
    private double softGapMinutes = 45.0;
    private double longGroundGapMinutes = 50.0;
    private double hardGapHours = 6.0;
    private double maxJumpKm = 500.0;
    private double sameHeadingDegrees = 90.0;
    private int minConsecutivePoints = 3;
    private double lookbackHorizonHours = 6.0;

    public double getSoftGapMinutes() {
      return softGapMinutes;
    }

    public void setSoftGapMinutes(double softGapMinutes) {
      this.softGapMinutes = softGapMinutes;
    }

    public double getLongGroundGapMinutes() {
      return longGroundGapMinutes;
    }

    public void setLongGroundGapMinutes(double longGroundGapMinutes) {
      this.longGroundGapMinutes = longGroundGapMinutes;
    }

    public double getHardGapHours() {
      return hardGapHours;
    }

    public void setHardGapHours(double hardGapHours) {
      this.hardGapHours = hardGapHours;
    }

    public double getMaxJumpKm() {
      return maxJumpKm;
    }

    public void setMaxJumpKm(double maxJumpKm) {
      this.maxJumpKm = maxJumpKm;
    }

    public double getSameHeadingDegrees() {
      return sameHeadingDegrees;
    }

    public void setSameHeadingDegrees(double sameHeadingDegrees) {
      this.sameHeadingDegrees = sameHeadingDegrees;
    }

    public int getMinConsecutivePoints() {
      return minConsecutivePoints;
    }

    public void setMinConsecutivePoints(int minConsecutivePoints) {
      this.minConsecutivePoints = minConsecutivePoints;
    }

    public double getLookbackHorizonHours() {
      return lookbackHorizonHours;
    }

    public void setLookbackHorizonHours(double lookbackHorizonHours) {
      this.lookbackHorizonHours = lookbackHorizonHours;
    }

    public Duration hardGap() {
      return hours(hardGapHours);
    }

    public Duration lookbackHorizon() {
      return hours(lookbackHorizonHours);
    }

    private static Duration hours(double hours) {
      return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }
  }

  /** Route scope applied to the written partitions. */
  public static class Scope {
    private ScopeMode mode = ScopeMode.ALL;
    private String isoCountry = "GB";
    private List<String> airports = new ArrayList<>();

    public ScopeMode getMode() {
      return mode;
    }

    public void setMode(ScopeMode mode) {
      this.mode = mode;
    }

    public String getIsoCountry() {
      return isoCountry;
    }

    public void setIsoCountry(String isoCountry) {
      this.isoCountry = isoCountry;
    }

    public List<String> getAirports() {
      return airports;
    }

    public void setAirports(List<String> airports) {
      this.airports = airports;
    }
  }

  /** Airport reference DB settings used to resolve the in-scope airport set. */
  public static class AirportDb {
    private boolean enabled = false;
    private String path = "";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }

  /**
   * Checks values the segmentation engine cannot work with.
   *
   * @throws IllegalStateException when a value is out of range
   */
  public void validate() {
    if (chunkSizeFiles <= 0) {
      throw new IllegalStateException("segmenter.chunk-size-files must be > 0");
    }
    if (segmentation.getHardGapHours() <= 0) {
      throw new IllegalStateException("segmenter.segmentation.hard-gap-hours must be > 0");
    }
    if (segmentation.getLookbackHorizonHours() <= 0) {
      throw new IllegalStateException("segmenter.segmentation.lookback-horizon-hours must be > 0");
    }
    if (segmentation.getMinConsecutivePoints() < 0) {
      throw new IllegalStateException("segmenter.segmentation.min-consecutive-points must be >= 0");
    }
  }
}
