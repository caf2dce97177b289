/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.main;

import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.ConfigurationException;
import org.fakehelp.mirror.conf.Key;
import org.fakehelp.mirror.cron.ShutdownHook;
import org.fakehelp.mirror.cron.UpdatePoller;
import org.fakehelp.mirror.persist.DataStore;
import org.fakehelp.mirror.persist.SelfHealingStore;
import org.fakehelp.mirror.persist.StoreException;
import org.fakehelp.mirror.query.MirrorService;
import org.fakehelp.mirror.sync.SyncEngine;
import org.fakehelp.mirror.upstream.HttpUpstreamClient;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.UpstreamClient;
import org.fakehelp.mirror.upstream.UpstreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Main class for starting a mirror instance.
 * <br>
 * Run with at most one argument, the path of the configuration file, i.e.
 * <br>
 * <code>java -jar fakehelp-mirror.jar [path/to/fakehelp.properties]</code>
 * <br>
 * If the configuration file does not exist, a default one is written and
 * the program exits.
 */
public class Main {

  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  /** Services of the running instance, for embedding applications. */
  private static MirrorService service;

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Path confPath;
    if (null == args || args.length == 0) {
      confPath = Paths.get(Configuration.CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("The mirror takes at most one argument.");
      return;
    }
    if (!Files.exists(confPath) || Files.size(confPath) < 1L) {
      writeDefaultConfig(confPath);
      return;
    }
    ShutdownHook shutdownHook;
    try {
      Configuration conf = new Configuration();
      conf.loadAndCheckConfiguration(confPath);
      shutdownHook = start(conf);
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    }
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    shutdownHook.stayAlive();
  }

  /**
   * Load or synchronize data, start polling for updates, and return the
   * hook that stops everything again.
   */
  static ShutdownHook start(Configuration conf) throws Exception {
    return start(conf, new HttpUpstreamClient(conf));
  }

  static ShutdownHook start(Configuration conf, UpstreamClient client)
      throws Exception {
    DataStore dataStore = new DataStore(conf.getPath(Key.DataPath));
    SyncEngine engine = new SyncEngine(conf, client, dataStore);
    SelfHealingStore store = new SelfHealingStore(dataStore, engine);
    logger.info("Starting mirror of {} storing data in {}.",
        conf.getUrl(Key.UpstreamUrl), dataStore.getRoot());
    engine.init();
    service = new MirrorService(conf, client, engine, store);
    UpdatePoller poller = new UpdatePoller(conf, client);
    Metadata baseline = poller.start((gameDataVersion, localizationVersion)
        -> engine.updateCheck(gameDataVersion, localizationVersion, false));
    /* Stored data may predate the baseline, which the poller will not
     * report as a change. */
    try {
      engine.updateCheck(baseline.getLatestGameDataVersion(),
          baseline.getLatestLocalizationVersion(), false);
    } catch (UpstreamException | StoreException e) {
      logger.error("Initial update check failed, serving stored data. "
          + "Reason: {}", e.getMessage(), e);
    }
    logger.info("Mirror started. {}", engine.getVersionState());
    return new ShutdownHook(poller, service.getPlayerCache(),
        conf.getLong(Key.ShutdownGraceWaitMinutes));
  }

  /** Return the service of the running instance, if started. */
  public static MirrorService getService() {
    return service;
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar fakehelp-mirror.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream defaults = Main.class.getClassLoader()
        .getResourceAsStream(Configuration.CONF_FILE)) {
      Files.copy(defaults, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". Set at least UpstreamUrl and "
          + "DataPath there and start again.");
    } catch (IOException e) {
      logger.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
