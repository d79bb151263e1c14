/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Replays responses previously dumped by {@link PrometheusRangeFetcher}
 * instead of contacting the backend, which is useful for debugging
 * reconciliation locally. The requested window is ignored.
 */
public class FileRangeFetcher implements RangeFetcher {

  private static final Logger logger = LoggerFactory.getLogger(
      FileRangeFetcher.class);

  private final Path replayDirectory;

  private final String windowName;

  /**
   * Create a fetcher replaying the dumped responses of the given window.
   *
   * @param replayDirectory Directory containing dumped responses.
   * @param windowName Name of the window whose dumps are replayed.
   */
  public FileRangeFetcher(Path replayDirectory, String windowName) {
    this.replayDirectory = replayDirectory;
    this.windowName = windowName;
  }

  @Override
  public RawQueryResult fetch(MetricQuery metric, Instant start, Instant end,
      Duration step) throws FetchException {
    Path replayFile = this.replayDirectory.resolve(
        PrometheusRangeFetcher.dumpFileName(this.windowName,
        metric.sourceKey()));
    logger.debug("Replaying {} from {}.", metric.sourceKey(), replayFile);
    byte[] body;
    try {
      body = Files.readAllBytes(replayFile);
    } catch (IOException e) {
      throw new FetchException(FetchException.Reason.Transport,
          "Cannot read " + replayFile + ": " + e.getMessage(), e);
    }
    return QueryRangeResponse.decode(body);
  }
}
