/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * All reconciled series of one window from a single successful pass.
 */
public final class Snapshot {

  private final String windowName;

  private final SortedMap<String, ReconciledSeries> series;

  Snapshot(String windowName, SortedMap<String, ReconciledSeries> series) {
    this.windowName = windowName;
    this.series = Collections.unmodifiableSortedMap(new TreeMap<>(series));
  }

  public String windowName() {
    return this.windowName;
  }

  /** Name of the snapshot file, e.g. {@code day-history.json}. */
  public String fileName() {
    return this.windowName + "-history.json";
  }

  /** Reconciled series by source key. */
  public SortedMap<String, ReconciledSeries> series() {
    return this.series;
  }

  /** Reconciled series of the given source key, or {@code null}. */
  public ReconciledSeries get(String sourceKey) {
    return this.series.get(sourceKey);
  }

  /**
   * Plain nested map as written to the snapshot file, i.e. source key to
   * timestamp to value.
   */
  SortedMap<String, SortedMap<Long, Double>> toValueMap() {
    SortedMap<String, SortedMap<Long, Double>> valueMap = new TreeMap<>();
    for (SortedMap.Entry<String, ReconciledSeries> e
        : this.series.entrySet()) {
      valueMap.put(e.getKey(), e.getValue().values());
    }
    return valueMap;
  }
}
