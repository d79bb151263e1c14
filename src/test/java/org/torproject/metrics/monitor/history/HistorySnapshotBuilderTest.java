/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class HistorySnapshotBuilderTest {

  private static final Instant NOW = Instant.ofEpochSecond(1685975201L);

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private final WindowConfig window = new WindowConfig("day",
      Duration.ofHours(24L), Duration.ofMinutes(30L), 2);

  private final MetricQuery good = new MetricQuery("good_prediction_total",
      "sum(good) OR vector(0)", CombinePolicy.Sum);

  private final MetricQuery subscriptions = new MetricQuery(
      "subscription_count_total", "subscription_count OR vector(0)",
      CombinePolicy.Overwrite);

  private final List<MetricQuery> metrics = Arrays.asList(this.good,
      this.subscriptions);

  /** Range fetcher answering from a map and recording its requests. */
  private static class StubRangeFetcher implements RangeFetcher {

    private final Map<String, Object> answers = new HashMap<>();

    private final List<Instant[]> requests = new ArrayList<>();

    private StubRangeFetcher answer(String sourceKey, Object answer) {
      this.answers.put(sourceKey, answer);
      return this;
    }

    @Override
    public RawQueryResult fetch(MetricQuery metric, Instant start,
        Instant end, Duration step) throws FetchException {
      this.requests.add(new Instant[] { start, end });
      Object answer = this.answers.get(metric.sourceKey());
      if (answer instanceof FetchException) {
        throw (FetchException) answer;
      }
      return (RawQueryResult) answer;
    }
  }

  private static RawQueryResult result(long timestamp, String... values) {
    List<RawSeries> series = new ArrayList<>();
    for (String value : values) {
      series.add(new RawSeries(Collections.singletonList(
          new RawSample(timestamp, value))));
    }
    return RawQueryResult.matrix(series);
  }

  private StubRangeFetcher successfulFetcher() {
    return new StubRangeFetcher()
        .answer("good_prediction_total", result(1685888801L, "1", "2"))
        .answer("subscription_count_total", result(1685888801L, "0", "9"));
  }

  private Map<String, Map<String, Double>> readSnapshot(Path path)
      throws Exception {
    return new ObjectMapper().readValue(path.toFile(),
        new TypeReference<Map<String, Map<String, Double>>>() {});
  }

  @Test
  public void testBuildSnapshot() throws Exception {
    StubRangeFetcher fetcher = this.successfulFetcher();
    Snapshot snapshot = new HistorySnapshotBuilder(fetcher).buildSnapshot(
        this.window, this.metrics, NOW);
    assertEquals("day", snapshot.windowName());
    assertEquals("day-history.json", snapshot.fileName());
    assertEquals(2, snapshot.series().size());
    assertEquals(3.0, snapshot.get("good_prediction_total")
        .get(1685888801L), 0.0);
    assertEquals(9.0, snapshot.get("subscription_count_total")
        .get(1685888801L), 0.0);
    assertEquals(2, fetcher.requests.size());
    for (Instant[] request : fetcher.requests) {
      assertEquals(NOW.minus(Duration.ofHours(24L)), request[0]);
      assertEquals(NOW, request[1]);
    }
  }

  @Test
  public void testSyncWindowWritesSnapshot() throws Exception {
    File outputDir = tmpf.newFolder("static");
    new HistorySnapshotBuilder(this.successfulFetcher()).syncWindow(
        this.window, this.metrics, outputDir.toPath(), NOW);
    Path snapshotPath = outputDir.toPath().resolve("day-history.json");
    assertTrue(Files.exists(snapshotPath));
    Map<String, Map<String, Double>> written = readSnapshot(snapshotPath);
    assertEquals(2, written.size());
    assertEquals(3.0, written.get("good_prediction_total").get("1685888801"),
        0.0);
    assertEquals(9.0,
        written.get("subscription_count_total").get("1685888801"), 0.0);
    assertArrayEquals(new String[] { "day-history.json" },
        outputDir.list());
  }

  @Test
  public void testFailedMetricKeepsPreviousSnapshot() throws Exception {
    File outputDir = tmpf.newFolder("static");
    Path snapshotPath = outputDir.toPath().resolve("day-history.json");
    byte[] previous = "{\"good_prediction_total\":{\"1\":1.0}}".getBytes();
    Files.write(snapshotPath, previous);
    FileTime previousTime = FileTime.fromMillis(1_600_000_000_000L);
    Files.setLastModifiedTime(snapshotPath, previousTime);
    FetchException cause = new FetchException(
        FetchException.Reason.Transport, "Connection refused");
    StubRangeFetcher fetcher = this.successfulFetcher()
        .answer("subscription_count_total", cause);
    try {
      new HistorySnapshotBuilder(fetcher).syncWindow(this.window,
          this.metrics, outputDir.toPath(), NOW);
      fail("Should have thrown a BuildException.");
    } catch (BuildException e) {
      assertEquals("subscription_count_total", e.failedKey());
      assertEquals(BuildException.Reason.PartialFailure, e.reason());
      assertSame(cause, e.getCause());
    }
    assertArrayEquals(previous, Files.readAllBytes(snapshotPath));
    assertEquals(previousTime, Files.getLastModifiedTime(snapshotPath));
    assertArrayEquals(new String[] { "day-history.json" },
        outputDir.list());
  }

  @Test
  public void testFirstFailureStopsPass() throws Exception {
    StubRangeFetcher fetcher = this.successfulFetcher()
        .answer("good_prediction_total",
            RawQueryResult.error("execution", "query timed out"));
    try {
      new HistorySnapshotBuilder(fetcher).buildSnapshot(this.window,
          this.metrics, NOW);
      fail("Should have thrown a BuildException.");
    } catch (BuildException e) {
      assertEquals("good_prediction_total", e.failedKey());
      assertTrue(e.getCause() instanceof ReconcileException);
    }
    assertEquals(1, fetcher.requests.size());
  }

  @Test
  public void testSnapshotWithGapIsWritten() throws Exception {
    File outputDir = tmpf.newFolder("static");
    WindowConfig dense = new WindowConfig("week", Duration.ofDays(7L),
        Duration.ofHours(2L));
    Snapshot snapshot = new HistorySnapshotBuilder(this.successfulFetcher())
        .syncWindow(dense, this.metrics, outputDir.toPath(), NOW);
    assertTrue(snapshot.get("good_prediction_total").hasGap());
    assertTrue(Files.exists(outputDir.toPath().resolve("week-history.json")));
  }

  @Test
  public void testWriteReplacesPreviousSnapshot() throws Exception {
    File outputDir = tmpf.newFolder("static");
    Path snapshotPath = outputDir.toPath().resolve("day-history.json");
    Files.write(snapshotPath, "{}".getBytes());
    HistorySnapshotBuilder builder = new HistorySnapshotBuilder(
        this.successfulFetcher());
    builder.writeSnapshot(builder.buildSnapshot(this.window, this.metrics,
        NOW), outputDir.toPath());
    assertEquals(2, readSnapshot(snapshotPath).size());
    assertFalse(Files.exists(outputDir.toPath()
        .resolve(".day-history.json.tmp")));
  }

  @Test
  public void testFailedMoveRemovesTemporaryFile() throws Exception {
    File outputDir = tmpf.newFolder("static");
    Path blocked = outputDir.toPath().resolve("day-history.json");
    Files.createDirectories(blocked);
    Files.write(blocked.resolve("occupied"), "x".getBytes());
    HistorySnapshotBuilder builder = new HistorySnapshotBuilder(
        this.successfulFetcher());
    Snapshot snapshot = builder.buildSnapshot(this.window, this.metrics, NOW);
    try {
      builder.writeSnapshot(snapshot, outputDir.toPath());
      fail("Should have thrown an IOException.");
    } catch (IOException e) {
      /* Replacing a non-empty directory is refused. */
    }
    assertArrayEquals(new String[] { "day-history.json" },
        outputDir.list());
    assertTrue(Files.isDirectory(blocked));
  }

  @Test
  public void testWriteCreatesOutputDirectory() throws Exception {
    Path outputDir = tmpf.getRoot().toPath().resolve("not/yet/there");
    HistorySnapshotBuilder builder = new HistorySnapshotBuilder(
        this.successfulFetcher());
    Path written = builder.writeSnapshot(builder.buildSnapshot(this.window,
        this.metrics, NOW), outputDir);
    assertEquals(outputDir.resolve("day-history.json"), written);
    assertTrue(Files.exists(written));
  }
}
