/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Dense series of one metric with one value per observed timestamp, sorted
 * by timestamp.
 */
public final class ReconciledSeries {

  private final SortedMap<Long, Double> values;

  private final int droppedSamples;

  private final boolean gap;

  ReconciledSeries(SortedMap<Long, Double> values, int droppedSamples,
      boolean gap) {
    this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    this.droppedSamples = droppedSamples;
    this.gap = gap;
  }

  /** Values by timestamp in seconds since the epoch. */
  public SortedMap<Long, Double> values() {
    return this.values;
  }

  public int size() {
    return this.values.size();
  }

  /** Value at the given timestamp, or {@code null} if there is none. */
  public Double get(long timestamp) {
    return this.values.get(timestamp);
  }

  /** Number of samples skipped because their value was not a number. */
  public int droppedSamples() {
    return this.droppedSamples;
  }

  /** Whether fewer values than expected for the window were found. */
  public boolean hasGap() {
    return this.gap;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ReconciledSeries)) {
      return false;
    }
    ReconciledSeries that = (ReconciledSeries) other;
    return this.values.equals(that.values)
        && this.droppedSamples == that.droppedSamples
        && this.gap == that.gap;
  }

  @Override
  public int hashCode() {
    return this.values.hashCode() * 31 + this.droppedSamples;
  }

  @Override
  public String toString() {
    return this.values.size() + " values, " + this.droppedSamples
        + " dropped" + (this.gap ? ", with gaps" : "");
  }
}
