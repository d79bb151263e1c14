/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.cron;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class of all modules run by the {@link Scheduler}.
 */
public abstract class MonitorMain implements Callable<Object>, Runnable {

  private static final Logger logger = LoggerFactory.getLogger(
      MonitorMain.class);

  private static final long LIMIT_MB = 200;

  protected Configuration config = new Configuration();

  private volatile boolean lastRunSucceeded;

  private final AtomicInteger consecutiveFailures = new AtomicInteger();

  public MonitorMain(Configuration conf) {
    this.config.putAll(conf.getPropertiesCopy());
  }

  /**
   * Log all errors preventing successful completion of the module.
   */
  @Override
  public final void run() {
    boolean succeeded = false;
    try {
      logger.info("Starting {} module of the monitor.", module());
      succeeded = startProcessing();
    } catch (Throwable th) { // Catching all to keep the periodic task alive.
      logger.error("The {} module failed: {}", module(), th.getMessage(), th);
    } finally {
      this.lastRunSucceeded = succeeded;
      if (succeeded) {
        this.consecutiveFailures.set(0);
        logger.info("Terminating {} module of the monitor.", module());
      } else {
        logger.warn("Terminating {} module of the monitor without result; "
            + "{} unsuccessful run(s) in a row.", module(),
            this.consecutiveFailures.incrementAndGet());
      }
    }
  }

  /**
   * Wrapper for {@code run}.
   */
  @Override
  public final Object call() {
    run();
    return null;
  }

  /** Whether the most recent run completed its work. */
  public boolean lastRunSucceeded() {
    return this.lastRunSucceeded;
  }

  /** Number of unsuccessful runs since the last successful one. */
  public int consecutiveFailures() {
    return this.consecutiveFailures.get();
  }

  /**
   * Module specific code goes here.
   *
   * @return Whether the module completed its work in this run.
   */
  protected abstract boolean startProcessing() throws ConfigurationException;

  /**
   * Returns the module name for logging purposes.
   */
  public abstract String module();

  /**
   * Checks the available space for the storage the given path is located on and
   * logs a warning, if 200 MiB or less are available, and otherwise logs
   * available space in TRACE level.
   */
  public static void checkAvailableSpace(Path location) {
    try {
      long megaBytes = Files.getFileStore(location.toFile()
          .getAbsoluteFile().toPath().getRoot()).getUsableSpace()
              / 1024 / 1024;
      if (megaBytes < LIMIT_MB) {
        logger.warn("Available storage critical for {}; only {} MiB left.",
            location, megaBytes);
      } else {
        logger.trace("Available storage for {}: {} MiB", location, megaBytes);
      }
    } catch (IOException ioe) {
      throw new RuntimeException("Cannot access " + location + " reason: "
          + ioe.getMessage(), ioe);
    }
  }
}
