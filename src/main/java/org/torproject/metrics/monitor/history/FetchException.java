/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * Thrown if a range query could not be sent or its response could not be
 * decoded.
 */
public class FetchException extends HistoryException {

  /** Why the fetch failed. */
  public enum Reason {
    /** Connection failure, timeout, or missing response body. */
    Transport,
    /** Response body does not match the expected schema. */
    Decode
  }

  private final Reason reason;

  public FetchException(Reason reason, String msg) {
    super(msg);
    this.reason = reason;
  }

  public FetchException(Reason reason, String msg, Throwable cause) {
    super(msg, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return this.reason;
  }
}
