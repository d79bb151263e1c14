/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One named metric to be synced: the range query expression, how to combine
 * overlapping samples, and the key under which the result is stored in the
 * snapshot.
 */
public final class MetricQuery {

  /** Property suffix holding the query expression of a metric. */
  public static final String EXPRESSION = ".Expression";

  /** Property suffix holding the combine policy of a metric. */
  public static final String COMBINE = ".Combine";

  private final String sourceKey;

  private final String expression;

  private final CombinePolicy combine;

  /**
   * Create a metric query.
   *
   * @param sourceKey Key of this metric in the snapshot.
   * @param expression Range query expression sent to the backend.
   * @param combine Policy for samples sharing a timestamp.
   */
  public MetricQuery(String sourceKey, String expression,
      CombinePolicy combine) {
    this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
    this.expression = Objects.requireNonNull(expression, "expression");
    this.combine = Objects.requireNonNull(combine, "combine");
  }

  public String sourceKey() {
    return this.sourceKey;
  }

  public String expression() {
    return this.expression;
  }

  public CombinePolicy combine() {
    return this.combine;
  }

  /**
   * Read all metrics listed in {@link Key#HistoryMetrics} from the given
   * configuration, e.g.
   * <pre>
   * HistoryMetrics = good_total, subscriptions
   * good_total.Expression = sum(good) OR vector(0)
   * good_total.Combine = Sum
   * subscriptions.Expression = subscription_count OR vector(0)
   * </pre>
   *
   * <p>The combine policy defaults to {@link CombinePolicy#Overwrite}.</p>
   *
   * @param conf Configuration to read from.
   * @return Metrics in configured order.
   * @throws ConfigurationException Thrown if the list is missing, contains
   *     duplicates, or a metric lacks an expression or has an unknown
   *     combine policy.
   */
  public static List<MetricQuery> listFromConfiguration(Configuration conf)
      throws ConfigurationException {
    if (!conf.has(Key.HistoryMetrics)) {
      throw new ConfigurationException("No metrics configured in "
          + Key.HistoryMetrics + ".");
    }
    List<MetricQuery> metrics = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String sourceKey : conf.getStringArray(Key.HistoryMetrics)) {
      if (sourceKey.isEmpty()) {
        continue;
      }
      if (!seen.add(sourceKey)) {
        throw new ConfigurationException("Metric " + sourceKey
            + " is listed more than once in " + Key.HistoryMetrics + ".");
      }
      String expression = conf.getProperty(sourceKey + EXPRESSION);
      if (null == expression || expression.trim().isEmpty()) {
        throw new ConfigurationException("Missing property: " + sourceKey
            + EXPRESSION);
      }
      String combineName = conf.getProperty(sourceKey + COMBINE,
          CombinePolicy.Overwrite.name()).trim();
      CombinePolicy combine;
      try {
        combine = CombinePolicy.valueOf(combineName);
      } catch (IllegalArgumentException iae) {
        throw new ConfigurationException("Corrupt property: " + sourceKey
            + COMBINE + " reason: " + iae.getMessage(), iae);
      }
      metrics.add(new MetricQuery(sourceKey, expression.trim(), combine));
    }
    return Collections.unmodifiableList(metrics);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MetricQuery)) {
      return false;
    }
    MetricQuery that = (MetricQuery) other;
    return this.sourceKey.equals(that.sourceKey)
        && this.expression.equals(that.expression)
        && this.combine == that.combine;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.sourceKey, this.expression, this.combine);
  }

  @Override
  public String toString() {
    return this.sourceKey + " (" + this.combine + "): " + this.expression;
  }
}
