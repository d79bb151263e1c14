/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of range query results. Implementations do not retry; the next
 * scheduled pass does.
 */
public interface RangeFetcher {

  /**
   * Run the expression of the given metric over the given window.
   *
   * @param metric Metric whose expression is evaluated.
   * @param start Inclusive window start.
   * @param end Inclusive window end.
   * @param step Sample interval.
   * @return Decoded result, which may still report a backend error.
   * @throws FetchException Thrown if the request fails or the response cannot
   *     be decoded.
   */
  RawQueryResult fetch(MetricQuery metric, Instant start, Instant end,
      Duration step) throws FetchException;
}
