/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses localization files consisting of {@code key|value} lines.
 *
 * <p>Lines starting with {@code #} are comments. Keys and values are
 * trimmed; a line without a key or without a value is skipped.</p>
 */
public final class LocalizationParser {

  private static final String COMMENT = "#";

  private static final Pattern SEPARATOR = Pattern.compile("\\|");

  private static final Pattern FILE_NAME_PARTS = Pattern.compile(
      "(Loc_)|(\\.txt)", Pattern.CASE_INSENSITIVE);

  private LocalizationParser() {
  }

  /**
   * Parse a single line.
   *
   * @param line Line to parse.
   * @return Key and value, or {@code null} if the line is a comment or
   *     misses one of them.
   */
  public static String[] parseLine(String line) {
    if (null == line || line.startsWith(COMMENT)) {
      return null;
    }
    String[] parts = SEPARATOR.split(line, -1);
    if (parts.length < 2) {
      return null;
    }
    String key = parts[0].trim();
    String value = parts[1].trim();
    if (key.isEmpty() || value.isEmpty()) {
      return null;
    }
    return new String[] { key, value };
  }

  /** Parse all lines that the given reader provides. */
  public static Map<String, String> parse(BufferedReader reader)
      throws IOException {
    Map<String, String> languageMap = new HashMap<>();
    String line;
    while (null != (line = reader.readLine())) {
      addLine(languageMap, line);
    }
    return languageMap;
  }

  /** Parse file contents that were already read into memory. */
  public static Map<String, String> parse(String content) {
    Map<String, String> languageMap = new HashMap<>();
    for (String line : content.split("\\r?\\n")) {
      addLine(languageMap, line);
    }
    return languageMap;
  }

  private static void addLine(Map<String, String> languageMap, String line) {
    String[] keyValue = parseLine(line);
    if (null != keyValue) {
      languageMap.put(keyValue[0], keyValue[1]);
    }
  }

  /**
   * Derive the language name from a bundle file name, e.g.,
   * {@code Loc_ENG_US.txt} becomes {@code ENG_US}.
   */
  public static String languageOf(String fileName) {
    String name = fileName;
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    return FILE_NAME_PARTS.matcher(name).replaceAll("")
        .toUpperCase(Locale.ROOT);
  }
}
