/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

/** The two independently versioned kinds of mirrored data. */
public enum Track {
  GAME_DATA,
  LOCALIZATION
}
