/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.conf;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  RunOnce(Boolean.class),
  PrometheusUrl(URL.class),
  OutputPath(Path.class),
  HistoryMetrics(String[].class),
  HistoryDumpResponses(Boolean.class),
  HistoryReplayPath(Path.class),
  DayActivated(Boolean.class),
  DayLookback(Duration.class),
  DayStep(Duration.class),
  DayMinExpectedSamples(Integer.class),
  DayOffsetMinutes(Integer.class),
  DayPeriodMinutes(Integer.class),
  WeekActivated(Boolean.class),
  WeekLookback(Duration.class),
  WeekStep(Duration.class),
  WeekMinExpectedSamples(Integer.class),
  WeekOffsetMinutes(Integer.class),
  WeekPeriodMinutes(Integer.class);

  private Class clazz;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

}
