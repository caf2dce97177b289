/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.fakehelp.mirror.upstream.LocalizationBundle;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class LocalizationBundleReaderTest {

  private final Set<String> allowed = new HashSet<>(
      Arrays.asList("ENG_US", "GER_DE"));

  /** Zip the given files and return the archive Base64-encoded. */
  static String zipBase64(Map<String, String> files) throws Exception {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(baos)) {
      for (Map.Entry<String, String> file : files.entrySet()) {
        zos.putArchiveEntry(new ZipArchiveEntry(file.getKey()));
        zos.write(file.getValue().getBytes(StandardCharsets.UTF_8));
        zos.closeArchiveEntry();
      }
    }
    return Base64.encodeBase64String(baos.toByteArray());
  }

  private Map<String, String> files() {
    Map<String, String> files = new LinkedHashMap<>();
    files.put("Loc_ENG_US.txt",
        "# comment\nKEY_A | Hello\nmalformed-line\nKEY_B|World\n");
    files.put("Loc_GER_DE.txt", "KEY_A|Hallo\n");
    files.put("Loc_FRE_FR.txt", "KEY_A|Bonjour\n");
    return files;
  }

  @Test
  public void testArchiveBundle() throws Exception {
    Map<String, Map<String, String>> languages
        = new LocalizationBundleReader(this.allowed).read(
        LocalizationBundle.ofArchive(zipBase64(this.files())));
    assertEquals(2, languages.size());
    assertFalse(languages.containsKey("FRE_FR"));
    Map<String, String> english = languages.get("ENG_US");
    assertEquals(2, english.size());
    assertEquals("Hello", english.get("KEY_A"));
    assertEquals("World", english.get("KEY_B"));
    assertEquals("Hallo", languages.get("GER_DE").get("KEY_A"));
  }

  @Test
  public void testExpandedBundle() throws Exception {
    Map<String, Map<String, String>> languages
        = new LocalizationBundleReader(this.allowed).read(
        LocalizationBundle.ofFiles(this.files()));
    assertEquals(2, languages.size());
    assertEquals("World", languages.get("ENG_US").get("KEY_B"));
    assertTrue(languages.containsKey("GER_DE"));
  }

  @Test
  public void testUmlautsSurviveArchive() throws Exception {
    Map<String, String> files = new LinkedHashMap<>();
    files.put("Loc_GER_DE.txt", "KEY_C|Grüße\n");
    Map<String, Map<String, String>> languages
        = new LocalizationBundleReader(this.allowed).read(
        LocalizationBundle.ofArchive(zipBase64(files)));
    assertEquals("Grüße", languages.get("GER_DE").get("KEY_C"));
  }
}
