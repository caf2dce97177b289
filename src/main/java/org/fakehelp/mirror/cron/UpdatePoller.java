/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.cron;

import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.ConfigurationException;
import org.fakehelp.mirror.conf.Key;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.UpstreamClient;
import org.fakehelp.mirror.upstream.UpstreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically asks upstream for its latest versions and tells a listener
 * whenever either of them differs from the last one seen.
 *
 * <p>A poll that fails, or whose listener fails, is logged and the next
 * poll runs as scheduled. A poll that starts while another one is still
 * running is skipped.</p>
 */
public class UpdatePoller implements ThreadFactory {

  private static final Logger logger = LoggerFactory.getLogger(
      UpdatePoller.class);

  private static final long MILLIS_IN_A_MINUTE = 60_000L;

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private final UpstreamClient client;

  private final long periodMillis;

  private final AtomicBoolean polling = new AtomicBoolean();

  private ScheduledExecutorService scheduler;

  private ScheduledFuture<?> task;

  private volatile VersionListener listener;

  private volatile String gameDataVersion;

  private volatile String localizationVersion;

  /** Create a poller running at the configured interval. */
  public UpdatePoller(Configuration conf, UpstreamClient client)
      throws ConfigurationException {
    this(client, conf.getInt(Key.UpdateIntervalMinutes) * MILLIS_IN_A_MINUTE);
  }

  /** Create a poller running every {@code periodMillis} milliseconds. */
  public UpdatePoller(UpstreamClient client, long periodMillis) {
    if (periodMillis < 1L) {
      throw new IllegalArgumentException("Poll period must be positive, but "
          + "is " + periodMillis + ".");
    }
    this.client = client;
    this.periodMillis = periodMillis;
  }

  /**
   * Record the current remote versions as baseline and start polling.
   *
   * @return The baseline versions.
   * @throws UpstreamException Thrown if the baseline cannot be fetched, in
   *     which case nothing is scheduled.
   */
  public synchronized Metadata start(VersionListener listener)
      throws UpstreamException {
    if (null != this.task) {
      throw new IllegalStateException("Poller is already running.");
    }
    Metadata baseline = this.client.getMetadata();
    this.gameDataVersion = baseline.getLatestGameDataVersion();
    this.localizationVersion = baseline.getLatestLocalizationVersion();
    this.listener = listener;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(this);
    this.task = this.scheduler.scheduleAtFixedRate(this::poll,
        this.periodMillis, this.periodMillis, TimeUnit.MILLISECONDS);
    logger.info("Update poller started with game data {} and localization "
        + "{}; polling every {} ms.", this.gameDataVersion,
        this.localizationVersion, this.periodMillis);
    return baseline;
  }

  /**
   * Run one poll now, unless another poll is in progress.
   *
   * @return Whether the poll ran.
   */
  public boolean poll() {
    if (!this.polling.compareAndSet(false, true)) {
      logger.debug("Previous update poll still running, skipping.");
      return false;
    }
    try {
      Metadata latest = this.client.getMetadata();
      String game = latest.getLatestGameDataVersion();
      String localization = latest.getLatestLocalizationVersion();
      if (Objects.equals(game, this.gameDataVersion)
          && Objects.equals(localization, this.localizationVersion)) {
        logger.debug("No new versions found.");
        return true;
      }
      logger.info("New versions found. Game data: {} -> {}, localization: "
          + "{} -> {}.", this.gameDataVersion, game,
          this.localizationVersion, localization);
      this.gameDataVersion = game;
      this.localizationVersion = localization;
      VersionListener current = this.listener;
      if (null != current) {
        current.versionChanged(game, localization);
      }
    } catch (Throwable th) { // Catching all to keep the schedule alive.
      logger.error("Update poll failed: {}", th.getMessage(), th);
    } finally {
      this.polling.set(false);
    }
    return true;
  }

  public String getGameDataVersion() {
    return this.gameDataVersion;
  }

  public String getLocalizationVersion() {
    return this.localizationVersion;
  }

  /** Cancel all future polls; a poll in progress is allowed to finish. */
  public void stop() {
    this.shutdown(0L);
  }

  /**
   * Cancel all future polls and wait at most the given number of minutes
   * for a poll in progress to finish.
   */
  public synchronized void shutdown(long graceMinutes) {
    if (null == this.task) {
      return;
    }
    this.task.cancel(false);
    this.scheduler.shutdown();
    try {
      if (graceMinutes > 0L && !this.scheduler.awaitTermination(graceMinutes,
          TimeUnit.MINUTES)) {
        logger.warn("Update poll did not finish within {} minutes.",
            graceMinutes);
        this.scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      this.scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
    this.task = null;
    this.scheduler = null;
    logger.info("Update poller stopped.");
  }

  /**
   * Provide a nice name for debugging.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("Update-Poller");
    return newThread;
  }
}
