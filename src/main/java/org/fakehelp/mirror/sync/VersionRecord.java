/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted record of the last completed update of a track, and for game
 * data the list of collections written by it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
class VersionRecord {

  static final String GAME_DATA_VERSION = "gameDataVersion";

  static final String LOCALIZATION_VERSION = "localizationVersion";

  @JsonProperty("versionString")
  String versionString;

  @JsonProperty("files")
  List<String> files;

  VersionRecord() {
  }

  static VersionRecord of(String versionString, List<String> files) {
    VersionRecord record = new VersionRecord();
    record.versionString = versionString;
    record.files = null == files ? null : new ArrayList<>(files);
    return record;
  }
}
