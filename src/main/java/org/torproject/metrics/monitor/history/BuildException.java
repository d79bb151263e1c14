/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * Thrown if a snapshot pass is aborted because one of its metrics could not
 * be fetched or reconciled. Nothing is written in that case.
 */
public class BuildException extends HistoryException {

  /** Why the pass failed. */
  public enum Reason {
    PartialFailure
  }

  private final String failedKey;

  /**
   * Create an exception for the given failed metric.
   *
   * @param failedKey Source key of the metric that failed.
   * @param cause Fetch or reconcile failure of that metric.
   */
  public BuildException(String failedKey, HistoryException cause) {
    super("Metric " + failedKey + " failed: " + cause.getMessage(), cause);
    this.failedKey = failedKey;
  }

  public Reason reason() {
    return Reason.PartialFailure;
  }

  public String failedKey() {
    return this.failedKey;
  }
}
