/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.cron;

import org.fakehelp.mirror.cache.TtlCache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops polling and releases the player cache when the JVM shuts down, and
 * keeps the main thread waiting until then.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final UpdatePoller poller;

  private final TtlCache<?> cache;

  private final long graceMinutes;

  private boolean stayAlive = true;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(UpdatePoller poller, TtlCache<?> cache,
      long graceMinutes) {
    super("Mirror-ShutdownThread");
    this.poller = poller;
    this.cache = cache;
    this.graceMinutes = graceMinutes;
  }

  /**
   * Stay alive until the shutdown thread gets run.
   */
  public void stayAlive() {
    synchronized (this) {
      while (this.stayAlive) {
        try {
          this.wait();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    logger.info("Waiting at most {} minutes for a running update poll ... ",
        this.graceMinutes);
    this.poller.shutdown(this.graceMinutes);
    this.cache.close();
    synchronized (this) {
      this.stayAlive = false;
      this.notifyAll();
    }
    logger.info("Shutdown finished. Exiting.");
  }
}
