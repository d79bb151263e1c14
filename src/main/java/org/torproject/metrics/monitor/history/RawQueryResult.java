/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed response of a single range query, before any reconciliation.
 */
public final class RawQueryResult {

  /** Result kind of range queries. */
  public static final String MATRIX = "matrix";

  /** Overall outcome reported by the backend. */
  public enum Status {
    Success,
    Error
  }

  private final Status status;

  private final String resultKind;

  private final List<RawSeries> series;

  private final List<String> warnings;

  private final String errorType;

  private final String errorDetail;

  /**
   * Create a query result.
   *
   * @param status Outcome reported by the backend.
   * @param resultKind Result type, {@code "matrix"} for range queries.
   * @param series Result series in response order.
   * @param warnings Warnings reported by the backend, possibly empty.
   * @param errorType Error type if {@code status} is {@link Status#Error}.
   * @param errorDetail Error message if {@code status} is
   *     {@link Status#Error}.
   */
  public RawQueryResult(Status status, String resultKind,
      List<RawSeries> series, List<String> warnings, String errorType,
      String errorDetail) {
    this.status = status;
    this.resultKind = resultKind;
    this.series = Collections.unmodifiableList(new ArrayList<>(series));
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    this.errorType = errorType;
    this.errorDetail = errorDetail;
  }

  /** Successful matrix result without warnings. */
  public static RawQueryResult matrix(List<RawSeries> series) {
    return new RawQueryResult(Status.Success, MATRIX, series,
        Collections.emptyList(), null, null);
  }

  /** Error result as reported by the backend. */
  public static RawQueryResult error(String errorType, String errorDetail) {
    return new RawQueryResult(Status.Error, null, Collections.emptyList(),
        Collections.emptyList(), errorType, errorDetail);
  }

  public Status status() {
    return this.status;
  }

  public String resultKind() {
    return this.resultKind;
  }

  public List<RawSeries> series() {
    return this.series;
  }

  public List<String> warnings() {
    return this.warnings;
  }

  public String errorType() {
    return this.errorType;
  }

  public String errorDetail() {
    return this.errorDetail;
  }
}
