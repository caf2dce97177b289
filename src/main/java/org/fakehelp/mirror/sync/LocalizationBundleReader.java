/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import org.fakehelp.mirror.upstream.LocalizationBundle;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Extracts per-language key/value maps from a localization bundle, keeping
 * only languages from the given allow-list.
 */
public class LocalizationBundleReader {

  private static final Logger logger = LoggerFactory.getLogger(
      LocalizationBundleReader.class);

  private final Set<String> languages;

  /**
   * Create a reader keeping the given languages.
   *
   * @param languages Upper-case language names, e.g., {@code ENG_US}.
   */
  public LocalizationBundleReader(Set<String> languages) {
    this.languages = languages;
  }

  /**
   * Read all allowed languages contained in the bundle.
   *
   * @return Language names mapped to their key/value maps.
   * @throws IOException Thrown if the archive cannot be decompressed.
   */
  public Map<String, Map<String, String>> read(LocalizationBundle bundle)
      throws IOException {
    return bundle.isArchive()
        ? this.readArchive(bundle.getEncodedArchive())
        : this.readFiles(bundle.getFiles());
  }

  private Map<String, Map<String, String>> readArchive(String encoded)
      throws IOException {
    Map<String, Map<String, String>> result = new LinkedHashMap<>();
    byte[] archive = Base64.decodeBase64(encoded);
    try (ZipArchiveInputStream zis = new ZipArchiveInputStream(
        new ByteArrayInputStream(archive))) {
      ZipArchiveEntry entry;
      while (null != (entry = zis.getNextZipEntry())) {
        if (entry.isDirectory()) {
          continue;
        }
        String language = LocalizationParser.languageOf(entry.getName());
        if (!this.languages.contains(language)) {
          logger.debug("Skipping {} localization.", language);
          continue;
        }
        /* Reader is not closed, it would close the archive stream. */
        BufferedReader reader = new BufferedReader(new InputStreamReader(
            zis, StandardCharsets.UTF_8));
        result.put(language, LocalizationParser.parse(reader));
      }
    }
    return result;
  }

  private Map<String, Map<String, String>> readFiles(
      Map<String, String> files) {
    Map<String, Map<String, String>> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> file : files.entrySet()) {
      String language = LocalizationParser.languageOf(file.getKey());
      if (!this.languages.contains(language)) {
        logger.debug("Skipping {} localization.", language);
        continue;
      }
      result.put(language, LocalizationParser.parse(file.getValue()));
    }
    return result;
  }
}
