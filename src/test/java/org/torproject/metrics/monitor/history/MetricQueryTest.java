/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import static org.junit.Assert.assertEquals;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class MetricQueryTest {

  private static Configuration twoMetrics() {
    Configuration conf = new Configuration();
    conf.setProperty(Key.HistoryMetrics.name(), "good, subscriptions");
    conf.setProperty("good" + MetricQuery.EXPRESSION, " sum(good) ");
    conf.setProperty("good" + MetricQuery.COMBINE, "Sum");
    conf.setProperty("subscriptions" + MetricQuery.EXPRESSION,
        "subscription_count OR vector(0)");
    return conf;
  }

  @Test
  public void testListFromConfiguration() throws Exception {
    List<MetricQuery> metrics = MetricQuery.listFromConfiguration(
        twoMetrics());
    assertEquals(Arrays.asList(
        new MetricQuery("good", "sum(good)", CombinePolicy.Sum),
        new MetricQuery("subscriptions", "subscription_count OR vector(0)",
            CombinePolicy.Overwrite)), metrics);
  }

  @Test
  public void testCombinePolicies() {
    assertEquals(4.0, CombinePolicy.Sum.combine(null, 4.0), 0.0);
    assertEquals(7.0, CombinePolicy.Sum.combine(3.0, 4.0), 0.0);
    assertEquals(4.0, CombinePolicy.Overwrite.combine(null, 4.0), 0.0);
    assertEquals(4.0, CombinePolicy.Overwrite.combine(3.0, 4.0), 0.0);
  }

  @Test(expected = ConfigurationException.class)
  public void testNoMetrics() throws Exception {
    MetricQuery.listFromConfiguration(new Configuration());
  }

  @Test(expected = ConfigurationException.class)
  public void testDuplicateMetric() throws Exception {
    Configuration conf = twoMetrics();
    conf.setProperty(Key.HistoryMetrics.name(), "good, subscriptions, good");
    MetricQuery.listFromConfiguration(conf);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingExpression() throws Exception {
    Configuration conf = twoMetrics();
    conf.setProperty(Key.HistoryMetrics.name(), "good, other");
    MetricQuery.listFromConfiguration(conf);
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownCombinePolicy() throws Exception {
    Configuration conf = twoMetrics();
    conf.setProperty("good" + MetricQuery.COMBINE, "Average");
    MetricQuery.listFromConfiguration(conf);
  }
}
