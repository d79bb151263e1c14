/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

/**
 * Base class of all errors that abort fetching, reconciling, or persisting
 * a history.
 */
public abstract class HistoryException extends Exception {

  protected HistoryException(String msg) {
    super(msg);
  }

  protected HistoryException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
