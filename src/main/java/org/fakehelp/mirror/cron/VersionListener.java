/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.cron;

/**
 * Receives remote version changes detected by the {@link UpdatePoller}.
 */
public interface VersionListener {

  /**
   * Called with the latest remote versions after at least one of them
   * changed. Any exception is logged by the poller and otherwise ignored.
   */
  void versionChanged(String gameDataVersion, String localizationVersion)
      throws Exception;

}
