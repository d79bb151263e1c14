/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor;

import org.torproject.metrics.monitor.conf.Configuration;
import org.torproject.metrics.monitor.conf.ConfigurationException;
import org.torproject.metrics.monitor.conf.Key;
import org.torproject.metrics.monitor.cron.MonitorMain;
import org.torproject.metrics.monitor.cron.Scheduler;
import org.torproject.metrics.monitor.cron.ShutdownHook;
import org.torproject.metrics.monitor.history.DayHistorySync;
import org.torproject.metrics.monitor.history.WeekHistorySync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;

/**
 * Main class for starting a monitor instance.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar monitor.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "monitor.properties";

  /** All possible main classes.
   * If a new MonitorMain class is available, just add it to this map.
   */
  static final Map<Key, Class<? extends MonitorMain>> monitorMains =
      new EnumMap<>(Key.class);

  static { // add a new main class here
    monitorMains.put(Key.DayActivated, DayHistorySync.class);
    monitorMains.put(Key.WeekActivated, WeekHistorySync.class);
  }

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Configuration conf = new Configuration();
    try {
      Path confPath;
      if (args == null || args.length == 0) {
        confPath = Paths.get(CONF_FILE);
      } else if (args.length == 1) {
        confPath = Paths.get(args[0]);
      } else {
        printUsage("The monitor takes at most one argument.");
        return;
      }
      if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
        writeDefaultConfig(confPath);
        return;
      } else {
        conf.loadAndCheckConfiguration(confPath);
      }
      Scheduler.getInstance().scheduleModuleRuns(monitorMains, conf);
      if (conf.getBool(Key.RunOnce)) {
        log.info("Single run of all activated modules finished.");
        return;
      }
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    }
    ShutdownHook shutdownHook = new ShutdownHook();
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    shutdownHook.stayAlive();
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar monitor.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream defaults = Main.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      if (null == defaults) {
        throw new IOException("Missing resource " + CONF_FILE);
      }
      Files.copy(defaults, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. In the default "
          + "configuration, no metrics backend is configured and no history "
          + "window is activated. You need to change the configuration ("
          + CONF_FILE + "), set PrometheusUrl and OutputPath, and activate "
          + "at least one window.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
