/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One result series of a range query: the series labels and the samples in
 * the order the backend sent them.
 */
public final class RawSeries {

  private final Map<String, String> labels;

  private final List<RawSample> samples;

  public RawSeries(Map<String, String> labels, List<RawSample> samples) {
    this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
    this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
  }

  /** Series without labels, as produced by a default vector. */
  public RawSeries(List<RawSample> samples) {
    this(Collections.emptyMap(), samples);
  }

  public Map<String, String> labels() {
    return this.labels;
  }

  public List<RawSample> samples() {
    return this.samples;
  }

  @Override
  public String toString() {
    return this.labels + " with " + this.samples.size() + " samples";
  }
}
