/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/** Display metadata of a unit definition. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitInfo {

  @JsonProperty("nameKey")
  String nameKey;

  @JsonProperty("combatType")
  Integer combatType;

  /** Crew members of a ship, as found in the unit definition. */
  @JsonProperty("crew")
  JsonNode crew;

  UnitInfo() {
  }

  public String getNameKey() {
    return this.nameKey;
  }

  public Integer getCombatType() {
    return this.combatType;
  }

  public JsonNode getCrew() {
    return this.crew;
  }
}
