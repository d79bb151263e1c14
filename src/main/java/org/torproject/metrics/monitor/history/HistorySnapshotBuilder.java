/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs one sync pass for one window: fetches and reconciles every configured
 * metric and, only if all of them succeeded, replaces the window's snapshot
 * file.
 *
 * <p>A failed pass writes nothing, so that readers keep seeing the last
 * complete snapshot rather than a mix of fresh, stale, and missing
 * metrics.</p>
 */
public class HistorySnapshotBuilder {

  private static final Logger logger = LoggerFactory.getLogger(
      HistorySnapshotBuilder.class);

  /**
   * Object mapper for writing snapshot files.
   */
  private static ObjectMapper objectMapper = new ObjectMapper();

  private final RangeFetcher fetcher;

  private final SeriesReconciler reconciler;

  public HistorySnapshotBuilder(RangeFetcher fetcher,
      SeriesReconciler reconciler) {
    this.fetcher = fetcher;
    this.reconciler = reconciler;
  }

  public HistorySnapshotBuilder(RangeFetcher fetcher) {
    this(fetcher, new SeriesReconciler());
  }

  /**
   * Fetch and reconcile all metrics for the window ending now.
   *
   * @param window Window to build.
   * @param metrics Metrics to include.
   * @param now End of the window.
   * @return Snapshot containing one series per metric.
   * @throws BuildException Thrown as soon as one metric fails.
   */
  public Snapshot buildSnapshot(WindowConfig window, List<MetricQuery> metrics,
      Instant now) throws BuildException {
    Instant start = now.minus(window.lookback());
    SortedMap<String, ReconciledSeries> series = new TreeMap<>();
    for (MetricQuery metric : metrics) {
      try {
        RawQueryResult result = this.fetcher.fetch(metric, start, now,
            window.step());
        ReconciledSeries reconciled = this.reconciler.reconcile(metric,
            result, window);
        logger.debug("Reconciled {} history of {}: {}.", window.name(),
            metric.sourceKey(), reconciled);
        series.put(metric.sourceKey(), reconciled);
      } catch (FetchException | ReconcileException e) {
        throw new BuildException(metric.sourceKey(), e);
      }
    }
    return new Snapshot(window.name(), series);
  }

  /**
   * Write the given snapshot to {@code <window>-history.json} in the given
   * directory, replacing any previous snapshot. The file is written to a
   * temporary file first and then moved into place, so that readers never
   * see a partially written file.
   *
   * @param snapshot Snapshot to write.
   * @param outputDirectory Directory containing snapshot files.
   * @return Path of the written snapshot file.
   * @throws IOException Thrown if the snapshot could not be written; the
   *     previous snapshot is left untouched in that case.
   */
  public Path writeSnapshot(Snapshot snapshot, Path outputDirectory)
      throws IOException {
    Files.createDirectories(outputDirectory);
    Path snapshotPath = outputDirectory.resolve(snapshot.fileName());
    Path tmpPath = outputDirectory.resolve("." + snapshot.fileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(tmpPath)) {
      objectMapper.writeValue(out, snapshot.toValueMap());
    } catch (IOException e) {
      throw discardTmp(tmpPath, e);
    }
    try {
      try {
        Files.move(tmpPath, snapshotPath, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        logger.debug("Atomic move not supported in {}; replacing {} "
            + "non-atomically.", outputDirectory, snapshot.fileName());
        Files.move(tmpPath, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw discardTmp(tmpPath, e);
    }
    return snapshotPath;
  }

  /** Delete the temporary file after the given write or move failure. */
  private static IOException discardTmp(Path tmpPath, IOException failure) {
    try {
      Files.deleteIfExists(tmpPath);
    } catch (IOException deleteFailure) {
      failure.addSuppressed(deleteFailure);
    }
    return failure;
  }

  /**
   * Build the snapshot for the window ending at {@code now} and write it.
   *
   * @return Written snapshot.
   * @throws BuildException Thrown if any metric failed; nothing is written.
   * @throws IOException Thrown if writing failed.
   */
  public Snapshot syncWindow(WindowConfig window, List<MetricQuery> metrics,
      Path outputDirectory, Instant now) throws BuildException, IOException {
    Snapshot snapshot = this.buildSnapshot(window, metrics, now);
    Path written = this.writeSnapshot(snapshot, outputDirectory);
    logger.info("Wrote {} history with {} metrics to {}.", window.name(),
        snapshot.series().size(), written);
    return snapshot;
  }
}
