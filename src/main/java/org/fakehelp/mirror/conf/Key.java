/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  DataPath(Path.class),
  UpstreamUrl(URL.class),
  AccessKey(String.class),
  SecretKey(String.class),
  UpstreamTimeoutMillis(Integer.class),
  PlayerCacheTimeMillis(Long.class),
  ConcurrentPlayers(Integer.class),
  ConcurrentGuilds(Integer.class),
  Languages(String[].class),
  NoLocalization(Boolean.class),
  UseSegments(Boolean.class),
  UseUnzip(Boolean.class),
  UpdateIntervalMinutes(Integer.class),
  ShutdownGraceWaitMinutes(Long.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
