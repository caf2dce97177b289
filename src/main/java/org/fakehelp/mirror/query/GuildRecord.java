/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * Raw guild record together with the raw player records of those members
 * that could be fetched.
 */
public final class GuildRecord {

  @JsonProperty("guild")
  private final JsonNode guild;

  @JsonProperty("members")
  private final List<JsonNode> members;

  GuildRecord(JsonNode guild, List<JsonNode> members) {
    this.guild = guild;
    this.members = Collections.unmodifiableList(members);
  }

  public JsonNode getGuild() {
    return this.guild;
  }

  public List<JsonNode> getMembers() {
    return this.members;
  }
}
