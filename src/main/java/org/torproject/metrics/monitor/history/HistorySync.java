/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;
import org.torproject.metrics.monitor.cron.MonitorMain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Periodic module that syncs the history of one window, e.g. the last day,
 * from the metrics backend into {@code <window>-history.json}.
 *
 * <p>Each window has its own subclass so that the {@code Scheduler} can run
 * it with its own offset and period. Runs of different windows never share
 * state, and the scheduler never runs the same window twice at a time.</p>
 */
public abstract class HistorySync extends MonitorMain {

  private static final Logger logger = LoggerFactory.getLogger(
      HistorySync.class);

  /** Progress of a window between and during passes. */
  public enum State {
    Idle,
    Fetching,
    Succeeded,
    Failed
  }

  private final String windowPrefix;

  private volatile State state = State.Idle;

  private volatile State lastOutcome;

  private volatile Instant lastSuccess;

  /**
   * Initialize this module with the given configuration.
   *
   * @param conf Configuration values.
   * @param windowPrefix Key prefix of the window, e.g. {@code "Day"}.
   */
  protected HistorySync(Configuration conf, String windowPrefix) {
    super(conf);
    this.windowPrefix = windowPrefix;
  }

  @Override
  public String module() {
    return this.windowName() + "-history";
  }

  /** Window name as used in file names, e.g. {@code "day"}. */
  String windowName() {
    return this.windowPrefix.toLowerCase(Locale.ROOT);
  }

  /** Current state of this window. */
  public State state() {
    return this.state;
  }

  /**
   * Outcome of the most recent pass, {@link State#Succeeded} or
   * {@link State#Failed}, or {@code null} if there was none yet.
   */
  public State lastOutcome() {
    return this.lastOutcome;
  }

  /** End of the window of the last successful pass, or {@code null}. */
  public Instant lastSuccess() {
    return this.lastSuccess;
  }

  @Override
  protected boolean startProcessing() throws ConfigurationException {
    WindowConfig window = WindowConfig.fromConfiguration(this.config,
        this.windowPrefix);
    List<MetricQuery> metrics = MetricQuery.listFromConfiguration(
        this.config);
    Path outputPath = this.config.getPath(Key.OutputPath);
    RangeFetcher fetcher = this.createFetcher(outputPath);
    if (null == fetcher) {
      return false;
    }
    return this.sync(new HistorySnapshotBuilder(fetcher), window, metrics,
        outputPath, Instant.now());
  }

  /**
   * Create the fetcher configured for this run, or return {@code null} if
   * neither a backend URL nor a replay directory is configured.
   */
  RangeFetcher createFetcher(Path outputPath) throws ConfigurationException {
    if (this.config.has(Key.HistoryReplayPath)) {
      Path replayPath = this.config.getPath(Key.HistoryReplayPath);
      logger.info("Replaying {} history from {} instead of fetching it.",
          this.module(), replayPath);
      return new FileRangeFetcher(replayPath, this.windowName());
    }
    if (!this.config.has(Key.PrometheusUrl)) {
      logger.warn("{} is not set, {} will not be synced.", Key.PrometheusUrl,
          this.module());
      return null;
    }
    return new PrometheusRangeFetcher(this.config.getUrl(Key.PrometheusUrl),
        this.config.getBool(Key.HistoryDumpResponses) ? outputPath : null,
        this.windowName());
  }

  /**
   * Run a single pass with the given builder, which is used by tests.
   *
   * @return Whether the snapshot file was replaced.
   */
  protected boolean sync(HistorySnapshotBuilder builder, WindowConfig window,
      List<MetricQuery> metrics, Path outputPath, Instant now) {
    logger.info("Syncing {} history of {} metrics...", window.name(),
        metrics.size());
    this.state = State.Fetching;
    State outcome = State.Failed;
    try {
      checkAvailableSpace(outputPath);
      builder.syncWindow(window, metrics, outputPath, now);
      outcome = State.Succeeded;
      this.lastSuccess = now;
      logger.info("Synced {} history.", window.name());
    } catch (BuildException e) {
      logger.warn("Could not sync {} history, keeping the previous snapshot. "
          + "Failed metric: {}. Reason: {}", window.name(), e.failedKey(),
          e.getMessage(), e);
    } catch (IOException e) {
      logger.warn("Could not write {} history, keeping the previous snapshot.",
          window.name(), e);
    } finally {
      this.lastOutcome = outcome;
      this.state = State.Idle;
    }
    return State.Succeeded == outcome;
  }
}
