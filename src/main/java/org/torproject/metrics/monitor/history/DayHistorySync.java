/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.conf.Configuration;

/**
 * Syncs the day history as configured by the {@code Day*} properties.
 */
public class DayHistorySync extends HistorySync {

  public DayHistorySync(Configuration conf) {
    super(conf, "Day");
  }
}
