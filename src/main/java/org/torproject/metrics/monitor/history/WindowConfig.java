/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Named rolling time range, like "day" or "week", with its own lookback and
 * sample step.
 */
public final class WindowConfig {

  public static final String LOOKBACK = "Lookback";
  public static final String STEP = "Step";
  public static final String MIN_EXPECTED_SAMPLES = "MinExpectedSamples";

  private final String name;

  private final Duration lookback;

  private final Duration step;

  private final int minExpectedSamples;

  /**
   * Create a window.
   *
   * @param name Window name, used as prefix of the snapshot file name.
   * @param lookback How far the window reaches into the past.
   * @param step Sample interval requested from the backend.
   * @param minExpectedSamples Number of samples below which a series is
   *     reported as having gaps.
   */
  public WindowConfig(String name, Duration lookback, Duration step,
      int minExpectedSamples) {
    this.name = Objects.requireNonNull(name, "name");
    this.lookback = Objects.requireNonNull(lookback, "lookback");
    this.step = checkStep(step);
    this.minExpectedSamples = minExpectedSamples;
  }

  /**
   * Create a window expecting one sample per step.
   */
  public WindowConfig(String name, Duration lookback, Duration step) {
    this(name, lookback, step, (int) (lookback.getSeconds()
        / checkStep(step).getSeconds()));
  }

  /** Steps are sent to the backend in whole seconds. */
  private static Duration checkStep(Duration step) {
    Objects.requireNonNull(step, "step");
    if (step.getSeconds() < 1L || step.getNano() != 0) {
      throw new IllegalArgumentException("Step must be a whole number of "
          + "seconds and at least one second: " + step);
    }
    return step;
  }

  /**
   * Read the window with the given key prefix, e.g. {@code "Day"} for
   * {@link Key#DayLookback}, {@link Key#DayStep}, and the optional
   * {@link Key#DayMinExpectedSamples}.
   */
  public static WindowConfig fromConfiguration(Configuration conf,
      String prefix) throws ConfigurationException {
    Key lookbackKey = windowKey(prefix, LOOKBACK);
    Key stepKey = windowKey(prefix, STEP);
    Key minKey = windowKey(prefix, MIN_EXPECTED_SAMPLES);
    String name = prefix.toLowerCase(Locale.ROOT);
    Duration lookback = conf.getDuration(lookbackKey);
    Duration step = conf.getDuration(stepKey);
    try {
      return conf.has(minKey)
          ? new WindowConfig(name, lookback, step, conf.getInt(minKey))
          : new WindowConfig(name, lookback, step);
    } catch (IllegalArgumentException iae) {
      throw new ConfigurationException("Corrupt property: " + stepKey
          + " reason: " + iae.getMessage(), iae);
    }
  }

  private static Key windowKey(String prefix, String suffix)
      throws ConfigurationException {
    try {
      return Key.valueOf(prefix + suffix);
    } catch (IllegalArgumentException iae) {
      throw new ConfigurationException("Unknown window " + prefix
          + ". Reason: " + iae.getMessage(), iae);
    }
  }

  public String name() {
    return this.name;
  }

  public Duration lookback() {
    return this.lookback;
  }

  public Duration step() {
    return this.step;
  }

  public int minExpectedSamples() {
    return this.minExpectedSamples;
  }

  @Override
  public String toString() {
    return this.name + " (lookback=" + this.lookback + ", step=" + this.step
        + ", minExpectedSamples=" + this.minExpectedSamples + ")";
  }
}
