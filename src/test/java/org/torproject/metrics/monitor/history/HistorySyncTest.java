/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.Key;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

public class HistorySyncTest {

  private static final Instant NOW = Instant.ofEpochSecond(1685975201L);

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private final WindowConfig window = new WindowConfig("day",
      Duration.ofHours(24L), Duration.ofMinutes(30L), 1);

  private final List<MetricQuery> metrics = Collections.singletonList(
      new MetricQuery("subscription_count_total",
          "subscription_count OR vector(0)", CombinePolicy.Overwrite));

  private Configuration dayConfiguration(File outputDir) {
    Configuration conf = new Configuration();
    conf.setProperty(Key.DayActivated.name(), "true");
    conf.setProperty(Key.DayLookback.name(), "PT24H");
    conf.setProperty(Key.DayStep.name(), "PT30M");
    conf.setProperty(Key.DayMinExpectedSamples.name(), "1");
    conf.setProperty(Key.OutputPath.name(), outputDir.getAbsolutePath());
    conf.setProperty(Key.HistoryMetrics.name(), "subscription_count_total");
    conf.setProperty("subscription_count_total" + MetricQuery.EXPRESSION,
        "subscription_count OR vector(0)");
    return conf;
  }

  @Test
  public void testModuleNames() {
    Configuration conf = new Configuration();
    assertEquals("day-history", new DayHistorySync(conf).module());
    assertEquals("week-history", new WeekHistorySync(conf).module());
  }

  @Test
  public void testSuccessfulSync() throws Exception {
    File outputDir = tmpf.newFolder("static");
    DayHistorySync sync = new DayHistorySync(dayConfiguration(outputDir));
    assertEquals(HistorySync.State.Idle, sync.state());
    assertNull(sync.lastOutcome());
    RangeFetcher fetcher = (metric, start, end, step)
        -> RawQueryResult.matrix(Collections.singletonList(new RawSeries(
        Collections.singletonList(new RawSample(1685888801L, "4")))));
    assertTrue(sync.sync(new HistorySnapshotBuilder(fetcher), this.window,
        this.metrics, outputDir.toPath(), NOW));
    assertEquals(HistorySync.State.Idle, sync.state());
    assertEquals(HistorySync.State.Succeeded, sync.lastOutcome());
    assertEquals(NOW, sync.lastSuccess());
    assertTrue(Files.exists(outputDir.toPath().resolve("day-history.json")));
  }

  @Test
  public void testFailedSync() throws Exception {
    File outputDir = tmpf.newFolder("static");
    DayHistorySync sync = new DayHistorySync(dayConfiguration(outputDir));
    RangeFetcher fetcher = mock(RangeFetcher.class);
    given(fetcher.fetch(any(), any(), any(), any())).willThrow(
        new FetchException(FetchException.Reason.Transport,
        "Connection refused"));
    assertFalse(sync.sync(new HistorySnapshotBuilder(fetcher), this.window,
        this.metrics, outputDir.toPath(), NOW));
    assertEquals(HistorySync.State.Idle, sync.state());
    assertEquals(HistorySync.State.Failed, sync.lastOutcome());
    assertNull(sync.lastSuccess());
    assertFalse(Files.exists(outputDir.toPath().resolve("day-history.json")));
  }

  @Test
  public void testFailureAfterSuccessKeepsLastSuccess() throws Exception {
    File outputDir = tmpf.newFolder("static");
    DayHistorySync sync = new DayHistorySync(dayConfiguration(outputDir));
    RangeFetcher good = (metric, start, end, step)
        -> RawQueryResult.matrix(Collections.emptyList());
    RangeFetcher bad = (metric, start, end, step)
        -> RawQueryResult.error("bad_data", "parse error");
    sync.sync(new HistorySnapshotBuilder(good), this.window, this.metrics,
        outputDir.toPath(), NOW);
    sync.sync(new HistorySnapshotBuilder(bad), this.window, this.metrics,
        outputDir.toPath(), NOW.plusSeconds(60L));
    assertEquals(HistorySync.State.Failed, sync.lastOutcome());
    assertEquals(NOW, sync.lastSuccess());
  }

  @Test
  public void testNoBackendConfigured() throws Exception {
    File outputDir = tmpf.newFolder("static");
    DayHistorySync sync = new DayHistorySync(dayConfiguration(outputDir));
    assertNull(sync.createFetcher(outputDir.toPath()));
    sync.run();
    assertNull(sync.lastOutcome());
    assertFalse(sync.lastRunSucceeded());
  }

  @Test
  public void testCreateFetcher() throws Exception {
    File outputDir = tmpf.newFolder("static");
    Configuration conf = dayConfiguration(outputDir);
    conf.setProperty(Key.PrometheusUrl.name(), "http://localhost:9090");
    assertTrue(new DayHistorySync(conf).createFetcher(outputDir.toPath())
        instanceof PrometheusRangeFetcher);
    conf.setProperty(Key.HistoryReplayPath.name(), outputDir.getPath());
    assertTrue(new DayHistorySync(conf).createFetcher(outputDir.toPath())
        instanceof FileRangeFetcher);
  }

  @Test
  public void testReplayRun() throws Exception {
    File outputDir = tmpf.newFolder("static");
    File replayDir = tmpf.newFolder("replay");
    Files.write(replayDir.toPath().resolve(PrometheusRangeFetcher
        .dumpFileName("day", "subscription_count_total")),
        ("{\"status\":\"success\","
        + "\"data\":{\"resultType\":\"matrix\",\"result\":["
        + "{\"metric\":{},\"values\":[[1685888801,\"0\"]]},"
        + "{\"metric\":{\"job\":\"subs\"},\"values\":[[1685888801,\"6\"]]}"
        + "]}}").getBytes(StandardCharsets.UTF_8));
    Configuration conf = dayConfiguration(outputDir);
    conf.setProperty(Key.HistoryReplayPath.name(), replayDir.getPath());
    DayHistorySync sync = new DayHistorySync(conf);
    sync.run();
    assertEquals(HistorySync.State.Succeeded, sync.lastOutcome());
    assertTrue(sync.lastRunSucceeded());
    Path snapshotPath = outputDir.toPath().resolve("day-history.json");
    assertEquals("{\"subscription_count_total\":{\"1685888801\":6.0}}",
        new String(Files.readAllBytes(snapshotPath), StandardCharsets.UTF_8));
  }
}
