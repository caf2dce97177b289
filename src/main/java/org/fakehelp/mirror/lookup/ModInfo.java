/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Display metadata of a stat mod definition. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModInfo {

  /** Rarity, shown as pips. */
  @JsonProperty("pips")
  Integer pips;

  @JsonProperty("set")
  String set;

  @JsonProperty("slot")
  Integer slot;

  ModInfo() {
  }

  public Integer getPips() {
    return this.pips;
  }

  public String getSet() {
    return this.set;
  }

  public Integer getSlot() {
    return this.slot;
  }
}
