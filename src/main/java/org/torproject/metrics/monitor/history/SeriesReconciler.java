/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns the result series of a range query into a single series with one
 * value per timestamp.
 *
 * <p>Queries of the form {@code expr OR vector(0)} return a dense series with
 * a default value for every step and, separately, a sparse series with the
 * real samples. Series are combined in response order, so with
 * {@link CombinePolicy#Overwrite} the default series must come first and the
 * sparse series last for real samples to win.</p>
 */
public class SeriesReconciler {

  private static final Logger logger = LoggerFactory.getLogger(
      SeriesReconciler.class);

  /**
   * Reconcile the given result of the given metric.
   *
   * @param metric Metric the result belongs to.
   * @param result Decoded range query result.
   * @param window Window the query covered, used for the density check.
   * @return Reconciled series.
   * @throws ReconcileException Thrown if the backend reported an error or the
   *     result is not a matrix.
   */
  public ReconciledSeries reconcile(MetricQuery metric, RawQueryResult result,
      WindowConfig window) throws ReconcileException {
    if (result.status() != RawQueryResult.Status.Success) {
      logger.warn("Could not sync {} history of {}: error type {}, error {}.",
          window.name(), metric.sourceKey(), result.errorType(),
          result.errorDetail());
      throw new ReconcileException(ReconcileException.Reason.BackendStatus,
          "Backend reported " + result.errorType() + " for "
          + metric.sourceKey() + ": " + result.errorDetail());
    }
    if (!RawQueryResult.MATRIX.equals(result.resultKind())) {
      throw new ReconcileException(ReconcileException.Reason.UnexpectedShape,
          "Expected result type " + RawQueryResult.MATRIX + " for "
          + metric.sourceKey() + ", but got " + result.resultKind() + ".");
    }
    for (String warning : result.warnings()) {
      logger.warn("Backend warning while syncing {} history of {}: {}",
          window.name(), metric.sourceKey(), warning);
    }
    SortedMap<Long, Double> values = new TreeMap<>();
    int dropped = 0;
    for (RawSeries series : result.series()) {
      for (RawSample sample : series.samples()) {
        Double value = parseValue(sample.rawValue());
        if (null == value) {
          logger.warn("Dropping sample of {} at {} that is not a number: {}",
              metric.sourceKey(), sample.timestamp(), sample.rawValue());
          dropped++;
          continue;
        }
        values.put(sample.timestamp(), metric.combine().combine(
            values.get(sample.timestamp()), value));
      }
    }
    boolean gap = values.size() < window.minExpectedSamples();
    if (gap) {
      logger.warn("Gap in {} history of {}: only {} of {} expected values.",
          window.name(), metric.sourceKey(), values.size(),
          window.minExpectedSamples());
    }
    return new ReconciledSeries(values, dropped, gap);
  }

  /**
   * Parse a sample value, returning {@code null} for anything that is not a
   * finite number. Non-finite values like {@code "NaN"} or {@code "+Inf"}
   * cannot be written to JSON snapshots.
   */
  static Double parseValue(String rawValue) {
    if (null == rawValue) {
      return null;
    }
    try {
      double value = Double.parseDouble(rawValue);
      return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
