/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Display metadata of a skill definition. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SkillInfo {

  /** Name key of the ability this skill refers to. */
  @JsonProperty("nameKey")
  String nameKey;

  @JsonProperty("isZeta")
  boolean zeta;

  /** Number of upgrade tiers. */
  @JsonProperty("tiers")
  int tiers;

  @JsonProperty("abilityId")
  String abilityId;

  SkillInfo() {
  }

  public String getNameKey() {
    return this.nameKey;
  }

  public boolean isZeta() {
    return this.zeta;
  }

  public int getTiers() {
    return this.tiers;
  }

  public String getAbilityId() {
    return this.abilityId;
  }
}
