/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.cron;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that starts the windows activated in monitor.properties.
 *
 * <p>Every activated window is one {@link MonitorMain} with its own fixed-rate
 * task, configured by {@code <Window>OffsetMinutes} and
 * {@code <Window>PeriodMinutes}. A window whose run fails is run again in its
 * next period, and the other windows are not affected. With
 * {@link Key#RunOnce} all activated windows run once in parallel and this
 * scheduler waits for them.</p>
 */
public final class Scheduler implements ThreadFactory {

  public static final String ACTIVATED = "Activated";
  public static final String PERIODMIN = "PeriodMinutes";
  public static final String OFFSETMIN = "OffsetMinutes";
  private static final long MILLIS_IN_A_MINUTE = 60_000L;
  private static final long DEFAULT_GRACE_MINUTES = 10L;
  private static final int POOL_SIZE = 4;

  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private int currentThreadNo = 0;
  private volatile long gracePeriodMinutes = DEFAULT_GRACE_MINUTES;

  private final ScheduledExecutorService scheduler =
      Executors.newScheduledThreadPool(POOL_SIZE, this);

  private static Scheduler instance = new Scheduler();

  private Scheduler(){}

  public static Scheduler getInstance() {
    return instance;
  }

  /**
   * Schedule or, with {@link Key#RunOnce}, run once all activated windows.
   *
   * @param monitorMains Module class by activation key, e.g.
   *     {@link Key#DayActivated}.
   * @param conf Configuration passed on to every module.
   * @return Modules that were scheduled, or that ran in case of a single
   *     run; a window that could not be scheduled is logged and left out.
   */
  public List<MonitorMain> scheduleModuleRuns(Map<Key,
      Class<? extends MonitorMain>> monitorMains, Configuration conf) {
    this.gracePeriodMinutes = readGracePeriod(conf);
    boolean runOnce = readRunOnce(conf);
    List<MonitorMain> modules = new ArrayList<>();
    for (Map.Entry<Key, Class<? extends MonitorMain>> entry
        : monitorMains.entrySet()) {
      String window = windowName(entry.getKey());
      try {
        if (!conf.getBool(entry.getKey())) {
          logger.debug("Window {} is not activated.", window);
          continue;
        }
        MonitorMain module = entry.getValue()
            .getConstructor(Configuration.class).newInstance(conf);
        if (!runOnce) {
          this.schedulePeriodic(module, window, conf);
        }
        modules.add(module);
      } catch (ConfigurationException | ReflectiveOperationException
          | RejectedExecutionException ex) {
        logger.error("Cannot schedule window {} ({}). Reason: {}", window,
            entry.getValue().getName(), ex.getMessage(), ex);
      }
    }
    if (runOnce) {
      this.runAllOnce(modules);
    }
    return Collections.unmodifiableList(modules);
  }

  private static long readGracePeriod(Configuration conf) {
    if (!conf.has(Key.ShutdownGraceWaitMinutes)) {
      return DEFAULT_GRACE_MINUTES;
    }
    try {
      return conf.getLong(Key.ShutdownGraceWaitMinutes);
    } catch (ConfigurationException ce) {
      logger.warn("Cannot read grace period, using {} minutes: {}",
          DEFAULT_GRACE_MINUTES, ce.getMessage());
      return DEFAULT_GRACE_MINUTES;
    }
  }

  private static boolean readRunOnce(Configuration conf) {
    try {
      return conf.getBool(Key.RunOnce);
    } catch (ConfigurationException ce) {
      logger.warn("Cannot read {}, scheduling periodic runs: {}", Key.RunOnce,
          ce.getMessage());
      return false;
    }
  }

  /** Window name of an activation key, e.g. "Day" for DayActivated. */
  static String windowName(Key activationKey) {
    String name = activationKey.name();
    return name.endsWith(ACTIVATED)
        ? name.substring(0, name.length() - ACTIVATED.length()) : name;
  }

  private void schedulePeriodic(MonitorMain module, String window,
      Configuration conf) throws ConfigurationException {
    Key offsetKey = windowKey(window, OFFSETMIN);
    Key periodKey = windowKey(window, PERIODMIN);
    int offset = conf.getInt(offsetKey);
    int period = conf.getInt(periodKey);
    if (period < 1) {
      throw new ConfigurationException(periodKey + " must be at least 1, "
          + "but is " + period + ".");
    }
    if (offset < 0) {
      throw new ConfigurationException(offsetKey + " must not be negative, "
          + "but is " + offset + ".");
    }
    long periodMillis = period * MILLIS_IN_A_MINUTE;
    long initialDelayMillis = computeInitialDelayMillis(
        System.currentTimeMillis(), offset * MILLIS_IN_A_MINUTE, periodMillis);
    logger.info("Window {} ({}) will first run in {} and then every {} "
        + "minute(s).", window, module.module(),
        initialDelayMillis < MILLIS_IN_A_MINUTE ? "under 1 minute"
        : (initialDelayMillis / MILLIS_IN_A_MINUTE) + " minute(s)", period);
    this.scheduler.scheduleAtFixedRate(module, initialDelayMillis,
        periodMillis, TimeUnit.MILLISECONDS);
  }

  private static Key windowKey(String window, String suffix)
      throws ConfigurationException {
    try {
      return Key.valueOf(window + suffix);
    } catch (IllegalArgumentException iae) {
      throw new ConfigurationException("Window " + window + " has no "
          + suffix + " key.", iae);
    }
  }

  private void runAllOnce(List<MonitorMain> modules) {
    logger.info("Running {} window(s) once.", modules.size());
    try {
      this.scheduler.invokeAll(modules);
    } catch (InterruptedException ie) {
      logger.warn("Interrupted while waiting for the single run to finish.");
      Thread.currentThread().interrupt();
      return;
    } catch (RejectedExecutionException ree) {
      logger.error("Cannot start single run: {}", ree.getMessage(), ree);
      return;
    }
    int failed = 0;
    for (MonitorMain module : modules) {
      if (!module.lastRunSucceeded()) {
        failed++;
        logger.warn("Single run of {} did not succeed.", module.module());
      }
    }
    logger.info("Single run finished: {} of {} window(s) succeeded.",
        modules.size() - failed, modules.size());
  }

  protected static long computeInitialDelayMillis(long currentMillis,
      long offsetMillis, long periodMillis) {
    return (periodMillis - (currentMillis % periodMillis) + offsetMillis)
        % periodMillis;
  }

  /**
   * Stop scheduling new runs and wait at most the configured grace period
   * for running windows; runs still pending after that are cancelled.
   */
  public void shutdownScheduler() {
    logger.info("Waiting at most {} minutes for running windows to finish.",
        this.gracePeriodMinutes);
    this.scheduler.shutdown();
    try {
      if (this.scheduler.awaitTermination(this.gracePeriodMinutes,
          TimeUnit.MINUTES)) {
        logger.info("All windows stopped.");
      } else {
        logger.warn("Grace period expired; cancelling {} pending run(s).",
            this.scheduler.shutdownNow().size());
      }
    } catch (InterruptedException ie) {
      logger.warn("Interrupted while waiting for windows to stop; cancelling "
          + "{} pending run(s).", this.scheduler.shutdownNow().size());
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("Monitor-Scheduled-Thread-" + ++currentThreadNo);
    logger.debug("New Thread created: {}", newThread.getName());
    return newThread;
  }
}
