/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * Single sample as returned by the backend, with the value still in its
 * string form.
 */
public final class RawSample {

  private final long timestamp;

  private final String rawValue;

  /**
   * Create a sample.
   *
   * @param timestamp Seconds since the epoch.
   * @param rawValue Value as sent by the backend, e.g. {@code "0.5"} or
   *     {@code "NaN"}.
   */
  public RawSample(long timestamp, String rawValue) {
    this.timestamp = timestamp;
    this.rawValue = rawValue;
  }

  public long timestamp() {
    return this.timestamp;
  }

  public String rawValue() {
    return this.rawValue;
  }

  @Override
  public String toString() {
    return "[" + this.timestamp + ", \"" + this.rawValue + "\"]";
  }
}
