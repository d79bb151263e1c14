/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * Thrown if a decoded range query result cannot be turned into a series.
 */
public class ReconcileException extends HistoryException {

  /** Why reconciliation failed. */
  public enum Reason {
    /** The backend reported an error instead of data. */
    BackendStatus,
    /** The result is not a matrix. */
    UnexpectedShape
  }

  private final Reason reason;

  public ReconcileException(Reason reason, String msg) {
    super(msg);
    this.reason = reason;
  }

  public Reason reason() {
    return this.reason;
  }
}
