/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

/**
 * Thrown if a collection is still missing or stale after one forced
 * synchronization.
 */
public class CollectionUnavailableException extends Exception {

  public CollectionUnavailableException(String collection, Throwable cause) {
    super("Unable to load game data collection " + collection, cause);
  }

}
