/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.lookup;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class LookupTableBuilderTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text.replace('\'', '"'));
  }

  private LookupTables build() throws Exception {
    return LookupTableBuilder.build(
        json("[{'baseId':'VADER','obtainable':true,'rarity':7,"
            + "'nameKey':'UNIT_VADER_NAME','combatType':1,'crew':[]},"
            + "{'baseId':'VADER','obtainable':true,'rarity':1,"
            + "'nameKey':'WRONG'},"
            + "{'baseId':'NPC','obtainable':false,'rarity':7,"
            + "'nameKey':'UNIT_NPC_NAME'},"
            + "{'baseId':'TIE','obtainable':true,'rarity':7,"
            + "'nameKey':'UNIT_TIE_NAME','combatType':2,"
            + "'crewList':[{'unitId':'VADER'}]}]"),
        json("[{'id':'uniqueskill_VADER01','abilityReference':'ua_VADER01',"
            + "'isZeta':true,'tierList':[{},{},{}]},"
            + "{'id':'basicskill_TIE','abilityReference':'ba_TIE',"
            + "'isZeta':false,'tier':[]}]"),
        json("[{'id':'ua_VADER01','nameKey':'ABILITY_VADER01_NAME'}]"),
        json("[{'id':'001','nameKey':'EQUIP_001_NAME'}]"),
        json("[{'id':'111','rarity':5,'setId':'1','slot':2}]"));
  }

  @Test
  public void testUnitsFilteredToObtainableMaxRarity() throws Exception {
    LookupTables tables = build();
    assertEquals(2, tables.getUnits().size());
    assertFalse(tables.getUnits().containsKey("NPC"));
    UnitInfo vader = tables.getUnits().get("VADER");
    assertEquals("UNIT_VADER_NAME", vader.getNameKey());
    assertEquals(Integer.valueOf(1), vader.getCombatType());
    assertEquals(0, vader.getCrew().size());
  }

  @Test
  public void testCrewFromLegacyListField() throws Exception {
    UnitInfo tie = build().getUnits().get("TIE");
    assertEquals(1, tie.getCrew().size());
    assertEquals("VADER", tie.getCrew().get(0).get("unitId").asText());
  }

  @Test
  public void testSkillsTakeNameFromAbility() throws Exception {
    LookupTables tables = build();
    SkillInfo unique = tables.getSkills().get("uniqueskill_VADER01");
    assertEquals("ABILITY_VADER01_NAME", unique.getNameKey());
    assertEquals("ua_VADER01", unique.getAbilityId());
    assertTrue(unique.isZeta());
    assertEquals(3, unique.getTiers());
    SkillInfo basic = tables.getSkills().get("basicskill_TIE");
    assertNull(basic.getNameKey());
    assertEquals(0, basic.getTiers());
  }

  @Test
  public void testEquipmentAndMods() throws Exception {
    LookupTables tables = build();
    assertEquals("EQUIP_001_NAME",
        tables.getEquipment().get("001").getNameKey());
    ModInfo mod = tables.getMods().get("111");
    assertEquals(Integer.valueOf(5), mod.getPips());
    assertEquals("1", mod.getSet());
    assertEquals(Integer.valueOf(2), mod.getSlot());
  }

  @Test
  public void testEmptyCollections() throws Exception {
    JsonNode empty = mapper.createArrayNode();
    assertTrue(LookupTableBuilder.build(empty, empty, empty, empty, empty)
        .isEmpty());
  }
}
