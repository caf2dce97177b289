/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

/** Synchronization state of a {@link Track}. */
public enum TrackState {

  /** Local data matches the last known remote version. */
  FRESH,

  /** Local data is missing or older than the remote version. */
  STALE,

  /** An update of this track is running. */
  UPDATING
}
