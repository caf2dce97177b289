/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Client game version and localization version currently offered. */
@JsonPropertyOrder({ "game", "language" })
public final class VersionInfo {

  @JsonProperty("game")
  private final String game;

  @JsonProperty("language")
  private final String language;

  public VersionInfo(String game, String language) {
    this.game = game;
    this.language = language;
  }

  public String getGame() {
    return this.game;
  }

  public String getLanguage() {
    return this.language;
  }

  @Override
  public String toString() {
    return "game=" + this.game + ", language=" + this.language;
  }
}
