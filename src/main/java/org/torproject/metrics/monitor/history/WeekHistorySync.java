/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.conf.Configuration;

/**
 * Syncs the week history as configured by the {@code Week*} properties.
 */
public class WeekHistorySync extends HistorySync {

  public WeekHistorySync(Configuration conf) {
    super(conf, "Week");
  }
}
