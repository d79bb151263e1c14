/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

/** This package syncs metric histories from the metrics backend.
 * <p>For every window, {@code HistorySync} lets a {@code RangeFetcher} run
 * each configured {@code MetricQuery}, has the {@code SeriesReconciler}
 * merge the returned series into one value per timestamp, and has the
 * {@code HistorySnapshotBuilder} replace {@code <window>-history.json} once
 * all metrics of the window are reconciled.</p>
 */
package org.torproject.metrics.monitor.history;
