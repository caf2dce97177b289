/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Localization bundle as delivered by the upstream service, either as a
 * Base64-encoded zip archive or as already expanded file contents.
 */
public final class LocalizationBundle {

  private final String encodedArchive;

  private final Map<String, String> files;

  private LocalizationBundle(String encodedArchive,
      Map<String, String> files) {
    this.encodedArchive = encodedArchive;
    this.files = files;
  }

  /** Bundle holding a Base64-encoded zip archive. */
  public static LocalizationBundle ofArchive(String encodedArchive) {
    return new LocalizationBundle(encodedArchive, null);
  }

  /** Bundle holding file names mapped to their text contents. */
  public static LocalizationBundle ofFiles(Map<String, String> files) {
    return new LocalizationBundle(null,
        Collections.unmodifiableMap(new LinkedHashMap<>(files)));
  }

  public boolean isArchive() {
    return null != this.encodedArchive;
  }

  public String getEncodedArchive() {
    return this.encodedArchive;
  }

  public Map<String, String> getFiles() {
    return this.files;
  }
}
