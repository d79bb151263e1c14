/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.torproject.metrics.monitor.downloader.Downloader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches range query results from a Prometheus compatible HTTP API.
 */
public class PrometheusRangeFetcher implements RangeFetcher {

  private static final Logger logger = LoggerFactory.getLogger(
      PrometheusRangeFetcher.class);

  static final String QUERY_RANGE_PATH = "/api/v1/query_range";

  /** File name prefix of dumped responses. */
  public static final String DUMP_PREFIX = "debug_";

  private final URL queryRangeUrl;

  private final Path dumpDirectory;

  private final String windowName;

  /**
   * Create a fetcher for the given base URL.
   *
   * @param baseUrl Base URL of the backend, e.g.
   *     {@code http://prometheus:9090}.
   * @param dumpDirectory Directory to write every raw response to as
   *     {@code debug_<window>_<sourceKey>.json}, or {@code null} to not dump
   *     responses.
   * @param windowName Name of the window this fetcher queries for, used in
   *     the names of dumped files.
   */
  public PrometheusRangeFetcher(URL baseUrl, Path dumpDirectory,
      String windowName) {
    String base = baseUrl.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    try {
      this.queryRangeUrl = new URL(base + QUERY_RANGE_PATH);
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException("Invalid base URL " + baseUrl, e);
    }
    this.dumpDirectory = dumpDirectory;
    this.windowName = windowName;
  }

  public PrometheusRangeFetcher(URL baseUrl) {
    this(baseUrl, null, null);
  }

  URL queryRangeUrl() {
    return this.queryRangeUrl;
  }

  @Override
  public RawQueryResult fetch(MetricQuery metric, Instant start, Instant end,
      Duration step) throws FetchException {
    Map<String, String> form = queryForm(metric.expression(), start, end,
        step);
    logger.debug("Fetching {} from {} with {}.", metric.sourceKey(),
        this.queryRangeUrl, form);
    byte[] body;
    try {
      body = Downloader.postFormToHttpServer(this.queryRangeUrl, form);
    } catch (IOException e) {
      throw new FetchException(FetchException.Reason.Transport,
          "Cannot fetch " + metric.sourceKey() + " from "
          + this.queryRangeUrl + ": " + e.getMessage(), e);
    }
    if (null == body) {
      throw new FetchException(FetchException.Reason.Transport,
          "No response body for " + metric.sourceKey() + " from "
          + this.queryRangeUrl + ".");
    }
    if (null != this.dumpDirectory) {
      this.dump(metric, body);
    }
    return QueryRangeResponse.decode(body);
  }

  /**
   * Build the form parameters of a range query. The expression is wrapped in
   * parentheses so that appended operators apply to the whole expression.
   */
  static Map<String, String> queryForm(String expression, Instant start,
      Instant end, Duration step) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("query", "(" + expression + ")");
    form.put("start", String.valueOf(start.getEpochSecond()));
    form.put("end", String.valueOf(end.getEpochSecond()));
    form.put("step", step.getSeconds() + "s");
    return form;
  }

  /**
   * Name of the file a response is dumped to and replayed from, e.g.
   * {@code debug_day_subscription_count_total.json}.
   */
  public static String dumpFileName(String windowName, String sourceKey) {
    return DUMP_PREFIX + windowName + "_" + sourceKey + ".json";
  }

  private void dump(MetricQuery metric, byte[] body) {
    Path dumpFile = this.dumpDirectory.resolve(dumpFileName(this.windowName,
        metric.sourceKey()));
    try {
      Files.createDirectories(this.dumpDirectory);
      Files.write(dumpFile, body);
      logger.debug("Dumped response for {} to {}.", metric.sourceKey(),
          dumpFile);
    } catch (IOException e) {
      logger.warn("Cannot dump response for {} to {}.", metric.sourceKey(),
          dumpFile, e);
    }
  }
}
