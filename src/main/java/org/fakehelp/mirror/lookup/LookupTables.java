/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Snapshot of the four lookup tables derived from game data: units,
 * equipment, skills, and mods, each keyed by definition identifier.
 *
 * <p>Instances are never modified; a rebuild produces a new snapshot.</p>
 */
public final class LookupTables {

  public static final String UNIT_MAP = "unitMap";
  public static final String EQUIP_MAP = "equipMap";
  public static final String SKILL_MAP = "skillMap";
  public static final String MOD_MAP = "modMap";

  private static final LookupTables EMPTY = new LookupTables(
      new HashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>());

  private final Map<String, UnitInfo> units;
  private final Map<String, EquipmentInfo> equipment;
  private final Map<String, SkillInfo> skills;
  private final Map<String, ModInfo> mods;

  /** Create a snapshot of the given tables. */
  public LookupTables(Map<String, UnitInfo> units,
      Map<String, EquipmentInfo> equipment, Map<String, SkillInfo> skills,
      Map<String, ModInfo> mods) {
    this.units = Collections.unmodifiableMap(new HashMap<>(units));
    this.equipment = Collections.unmodifiableMap(new HashMap<>(equipment));
    this.skills = Collections.unmodifiableMap(new HashMap<>(skills));
    this.mods = Collections.unmodifiableMap(new HashMap<>(mods));
  }

  public static LookupTables empty() {
    return EMPTY;
  }

  public Map<String, UnitInfo> getUnits() {
    return this.units;
  }

  public Map<String, EquipmentInfo> getEquipment() {
    return this.equipment;
  }

  public Map<String, SkillInfo> getSkills() {
    return this.skills;
  }

  public Map<String, ModInfo> getMods() {
    return this.mods;
  }

  public boolean isEmpty() {
    return this.units.isEmpty() && this.equipment.isEmpty()
        && this.skills.isEmpty() && this.mods.isEmpty();
  }
}
