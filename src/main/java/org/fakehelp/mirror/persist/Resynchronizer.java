/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

import org.fakehelp.mirror.upstream.UpstreamException;

/**
 * Forces a full synchronization of all stored game data.
 */
@FunctionalInterface
public interface Resynchronizer {

  /** Fetch and store all game data regardless of recorded versions. */
  void resynchronize() throws UpstreamException, StoreException;

}
