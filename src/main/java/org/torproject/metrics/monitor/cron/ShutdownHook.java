/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Keeps the main thread alive while the windows are synced periodically and,
 * when the process is asked to terminate, stops the scheduled windows before
 * releasing the main thread.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final Runnable stopWindows;

  private final CountDownLatch stopped = new CountDownLatch(1);

  /** Stops the {@link Scheduler} on shutdown. */
  public ShutdownHook() {
    this(Scheduler.getInstance()::shutdownScheduler);
  }

  /**
   * Run the given action on shutdown.
   *
   * @param stopWindows Stops all scheduled windows, waiting for running ones.
   */
  ShutdownHook(Runnable stopWindows) {
    super("Monitor-ShutdownThread");
    this.stopWindows = stopWindows;
  }

  /**
   * Block the calling thread until this hook has run or the calling thread
   * is interrupted; the interrupt status is kept in the latter case.
   */
  public void stayAlive() {
    try {
      this.stopped.await();
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for shutdown.");
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    try {
      this.stopWindows.run();
    } finally {
      this.stopped.countDown();
    }
    logger.info("Shutdown finished. Exiting.");
  }
}
