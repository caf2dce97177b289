/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Derives {@link LookupTables} from freshly stored game-data collections.
 */
public final class LookupTableBuilder {

  public static final String UNITS = "units";
  public static final String SKILL = "skill";
  public static final String ABILITY = "ability";
  public static final String EQUIPMENT = "equipment";
  public static final String STAT_MOD = "statMod";

  /** Collections the lookup tables are built from. */
  public static final String[] SOURCE_COLLECTIONS = {
      UNITS, SKILL, ABILITY, EQUIPMENT, STAT_MOD };

  /** Only units at this rarity are complete definitions. */
  private static final int MAX_RARITY = 7;

  private LookupTableBuilder() {
  }

  /**
   * Build all four tables from the given collections.
   *
   * @param units Unit definitions; only obtainable seven-star definitions
   *     are used.
   * @param skills Skill definitions.
   * @param abilities Ability definitions, used for skill names.
   * @param equipment Equipment definitions.
   * @param mods Stat mod definitions.
   * @return New lookup tables.
   */
  public static LookupTables build(JsonNode units, JsonNode skills,
      JsonNode abilities, JsonNode equipment, JsonNode mods) {
    Map<String, String> abilityNames = new HashMap<>();
    for (JsonNode ability : abilities) {
      abilityNames.put(ability.path("id").asText(),
          textOrNull(ability, "nameKey"));
    }
    Map<String, UnitInfo> unitMap = new HashMap<>();
    for (JsonNode unit : units) {
      if (!unit.path("obtainable").asBoolean()
          || unit.path("rarity").asInt() != MAX_RARITY) {
        continue;
      }
      UnitInfo info = new UnitInfo();
      info.nameKey = textOrNull(unit, "nameKey");
      info.combatType = unit.hasNonNull("combatType")
          ? unit.get("combatType").asInt() : null;
      info.crew = listField(unit, "crew");
      unitMap.put(unit.path("baseId").asText(), info);
    }
    Map<String, EquipmentInfo> equipMap = new HashMap<>();
    for (JsonNode item : equipment) {
      EquipmentInfo info = new EquipmentInfo();
      info.nameKey = textOrNull(item, "nameKey");
      equipMap.put(item.path("id").asText(), info);
    }
    Map<String, SkillInfo> skillMap = new HashMap<>();
    for (JsonNode skill : skills) {
      SkillInfo info = new SkillInfo();
      info.abilityId = textOrNull(skill, "abilityReference");
      info.nameKey = abilityNames.get(info.abilityId);
      info.zeta = skill.path("isZeta").asBoolean();
      JsonNode tiers = listField(skill, "tier");
      info.tiers = null == tiers ? 0 : tiers.size();
      skillMap.put(skill.path("id").asText(), info);
    }
    Map<String, ModInfo> modMap = new HashMap<>();
    for (JsonNode mod : mods) {
      ModInfo info = new ModInfo();
      info.pips = mod.hasNonNull("rarity") ? mod.get("rarity").asInt() : null;
      info.set = textOrNull(mod, "setId");
      info.slot = mod.hasNonNull("slot") ? mod.get("slot").asInt() : null;
      modMap.put(mod.path("id").asText(), info);
    }
    return new LookupTables(unitMap, equipMap, skillMap, modMap);
  }

  private static String textOrNull(JsonNode node, String field) {
    return node.hasNonNull(field) ? node.get(field).asText() : null;
  }

  /* Lists may have been stored with the legacy "List" suffix. */
  private static JsonNode listField(JsonNode node, String field) {
    if (node.hasNonNull(field)) {
      return node.get(field);
    }
    return node.hasNonNull(field + "List") ? node.get(field + "List") : null;
  }
}
