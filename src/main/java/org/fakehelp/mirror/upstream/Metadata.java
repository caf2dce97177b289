/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latest version identifiers announced by the upstream service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Metadata {

  @JsonProperty("latestGamedataVersion")
  private String latestGameDataVersion;

  @JsonProperty("latestLocalizationBundleVersion")
  private String latestLocalizationVersion;

  /** Used by Jackson. */
  Metadata() {
  }

  public Metadata(String latestGameDataVersion,
      String latestLocalizationVersion) {
    this.latestGameDataVersion = latestGameDataVersion;
    this.latestLocalizationVersion = latestLocalizationVersion;
  }

  public String getLatestGameDataVersion() {
    return this.latestGameDataVersion;
  }

  public String getLatestLocalizationVersion() {
    return this.latestLocalizationVersion;
  }

  @Override
  public String toString() {
    return "Game: " + this.latestGameDataVersion + ", Localization: "
        + this.latestLocalizationVersion;
  }
}
