/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * How samples of the same metric that share a timestamp are combined into a
 * single value.
 */
public enum CombinePolicy {

  /** Values for the same timestamp are added up. */
  Sum {
    @Override
    double combine(Double existing, double value) {
      return null == existing ? value : existing + value;
    }
  },

  /**
   * The value written last for a timestamp wins, so that series listed later
   * in a response override series listed earlier.
   */
  Overwrite {
    @Override
    double combine(Double existing, double value) {
      return value;
    }
  };

  /**
   * Combine a newly observed value with the value already stored for the
   * same timestamp.
   *
   * @param existing Value stored so far, or {@code null} if there is none.
   * @param value Newly observed value.
   * @return Value to store.
   */
  abstract double combine(Double existing, double value);
}
