/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.Key;
import org.fakehelp.mirror.lookup.LookupTables;
import org.fakehelp.mirror.persist.DataStore;
import org.fakehelp.mirror.persist.StoreException;
import org.fakehelp.mirror.persist.VersionedDocument;
import org.fakehelp.mirror.upstream.LocalizationBundle;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.Segment;
import org.fakehelp.mirror.upstream.UpstreamException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

public class SyncEngineTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private final ObjectMapper mapper = new ObjectMapper();

  private FakeUpstreamClient upstream;

  private CountingStore store;

  /** Store counting its writes, optionally failing on one document. */
  private static class CountingStore extends DataStore {

    private int writes;

    private String failingDocument;

    private CountingStore(Path root) {
      super(root);
    }

    @Override
    public void write(String name, Object document) throws StoreException {
      this.writes++;
      if (name.equals(this.failingDocument)) {
        throw new StoreException(StoreException.Kind.IO_ERROR, name,
            "disk full", null);
      }
      super.write(name, document);
    }
  }

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text.replace('\'', '"'));
  }

  private Configuration conf(boolean useSegments, boolean noLocalization) {
    Configuration conf = new Configuration();
    conf.setProperty(Key.Languages.name(), "ENG_US, GER_DE");
    conf.setProperty(Key.NoLocalization.name(),
        String.valueOf(noLocalization));
    conf.setProperty(Key.UseSegments.name(), String.valueOf(useSegments));
    conf.setProperty(Key.UseUnzip.name(), "true");
    return conf;
  }

  private SyncEngine engine() throws Exception {
    return new SyncEngine(conf(false, false), this.upstream, this.store);
  }

  /** Whole-mode game data with units and an empty skill collection. */
  @Before
  public void prepareUpstream() throws Exception {
    this.upstream = new FakeUpstreamClient();
    Map<String, JsonNode> whole = new LinkedHashMap<>();
    whole.put("units", json("[{'baseId':'VADER','obtainable':true,"
        + "'rarity':7,'nameKey':'UNIT_VADER_NAME','combatType':1}]"));
    whole.put("skill", json("[]"));
    whole.put("equipment", json("[{'id':'001','nameKey':'EQ_001'}]"));
    this.upstream.gameData.put(null, whole);
    Map<String, String> files = new LinkedHashMap<>();
    files.put("Loc_ENG_US.txt",
        "# comment\nKEY_A | Hello\nmalformed-line\nKEY_B|World\n");
    files.put("Loc_FRE_FR.txt", "KEY_A|Bonjour\n");
    this.upstream.bundle = LocalizationBundle.ofFiles(files);
    this.store = new CountingStore(tmpf.getRoot().toPath());
  }

  @Test
  public void testNeedsUpdate() throws Exception {
    SyncEngine engine = engine();
    assertTrue(engine.needsUpdate(Track.GAME_DATA, "1.0.0:abc", false));
    assertTrue(engine.needsUpdate(Track.LOCALIZATION, "loc-1", false));
    engine.updateCheck("1.0.0:abc", "loc-1", false);
    assertFalse(engine.needsUpdate(Track.GAME_DATA, "1.0.0:abc", false));
    assertTrue(engine.needsUpdate(Track.GAME_DATA, "1.0.0:abd", false));
    assertTrue(engine.needsUpdate(Track.GAME_DATA, "0.9.9:abc", false));
    assertTrue(engine.needsUpdate(Track.GAME_DATA, "1.0.0:abc", true));
    assertFalse(engine.needsUpdate(Track.LOCALIZATION, "loc-1", false));
    assertTrue(engine.needsUpdate(Track.LOCALIZATION, "loc-2", false));
  }

  @Test
  public void testSecondUpdateCheckWritesNothing() throws Exception {
    SyncEngine engine = engine();
    engine.updateCheck("1.0.0:abc", "loc-1", false);
    int writes = this.store.writes;
    VersionState state = engine.updateCheck("1.0.0:abc", "loc-1", false);
    assertEquals(writes, this.store.writes);
    assertEquals(1, this.upstream.gameDataCalls);
    assertEquals(1, this.upstream.localizationCalls);
    assertEquals("1.0.0:abc", state.getGameDataVersion());
  }

  @Test
  public void testWholeModeStoresNonEmptyCollections() throws Exception {
    SyncEngine engine = engine();
    VersionState state = engine.updateGameData("1.0.0:abc");
    assertThat(state.getKnownCollections(),
        containsInAnyOrder("units", "equipment"));
    assertFalse(Files.exists(this.store.pathOf("skill")));
    VersionedDocument<JsonNode> units = this.store.read("units",
        new TypeReference<VersionedDocument<JsonNode>>() {});
    assertEquals("1.0.0:abc", units.getVersion());
    assertEquals("VADER", units.getData().get(0).get("baseId").asText());
    VersionRecord record = this.store.read(VersionRecord.GAME_DATA_VERSION,
        VersionRecord.class);
    assertEquals("1.0.0:abc", record.versionString);
    assertThat(record.files, containsInAnyOrder("units", "equipment"));
    assertEquals(TrackState.FRESH, engine.getTrackState(Track.GAME_DATA));
    assertEquals(Arrays.asList((Integer) null),
        this.upstream.requestedSegments);
  }

  @Test
  public void testLookupTablesRebuiltAndStored() throws Exception {
    SyncEngine engine = engine();
    engine.updateGameData("1.0.0:abc");
    LookupTables tables = engine.getLookupTables();
    assertEquals("UNIT_VADER_NAME",
        tables.getUnits().get("VADER").getNameKey());
    assertEquals("EQ_001", tables.getEquipment().get("001").getNameKey());
    assertTrue(tables.getSkills().isEmpty());
    for (String name : new String[] { LookupTables.UNIT_MAP,
        LookupTables.EQUIP_MAP, LookupTables.SKILL_MAP,
        LookupTables.MOD_MAP }) {
      assertTrue(name, this.store.exists(name));
    }
    JsonNode unitMap = this.store.read(LookupTables.UNIT_MAP, JsonNode.class);
    assertEquals(1, unitMap.get("VADER").get("combatType").asInt());
  }

  @Test
  public void testSegmentedModeSkipsSentinels() throws Exception {
    this.upstream.segments.addAll(Arrays.asList(new Segment("NONE", 0),
        new Segment("units", 1), new Segment("rest", 2),
        new Segment("ALL", 3)));
    Map<String, JsonNode> first = new LinkedHashMap<>();
    first.put("units", json("[{'baseId':'A','obtainable':true,"
        + "'rarity':7}]"));
    Map<String, JsonNode> second = new LinkedHashMap<>();
    second.put("statMod", json("[{'id':'111','rarity':5}]"));
    second.put("units", json("[]"));
    this.upstream.gameData.put(1, first);
    this.upstream.gameData.put(2, second);
    SyncEngine engine = new SyncEngine(conf(true, false), this.upstream,
        this.store);
    VersionState state = engine.updateGameData("2.0.0:seg");
    assertThat(this.upstream.requestedSegments, contains(1, 2));
    assertThat(state.getKnownCollections(),
        containsInAnyOrder("units", "statMod"));
    assertEquals(1, engine.getLookupTables().getUnits().size());
    assertEquals(Integer.valueOf(5),
        engine.getLookupTables().getMods().get("111").getPips());
  }

  @Test
  public void testLocalizationUpdate() throws Exception {
    SyncEngine engine = engine();
    engine.updateLocalizationBundle("loc-7");
    Map<String, String> english = engine.getLanguage("eng_us");
    assertEquals(2, english.size());
    assertEquals("Hello", english.get("KEY_A"));
    assertEquals("World", english.get("KEY_B"));
    assertNull(engine.getLanguage("FRE_FR"));
    assertFalse(this.store.exists("FRE_FR"));
    VersionedDocument<Map<String, String>> stored = this.store.read("ENG_US",
        new TypeReference<VersionedDocument<Map<String, String>>>() {});
    assertEquals("loc-7", stored.getVersion());
    assertEquals("loc-7", engine.getVersionState().getLocalizationVersion());
    assertEquals("loc-7", this.store.read(VersionRecord.LOCALIZATION_VERSION,
        VersionRecord.class).versionString);
  }

  @Test
  public void testNoLocalizationSkipsBundle() throws Exception {
    SyncEngine engine = new SyncEngine(conf(false, true), this.upstream,
        this.store);
    engine.updateCheck(null, null, true);
    assertEquals(0, this.upstream.localizationCalls);
    assertNull(engine.getVersionState().getLocalizationVersion());
    assertFalse(this.store.exists(VersionRecord.LOCALIZATION_VERSION));
  }

  @Test
  public void testFailedUpdateKeepsPreviousState() throws Exception {
    SyncEngine engine = engine();
    engine.updateCheck("1.0.0:abc", "loc-1", false);
    VersionState before = engine.getVersionState();
    LookupTables tablesBefore = engine.getLookupTables();
    UpstreamException failure = new UpstreamException(
        UpstreamException.Kind.TRANSIENT, "timeout");
    this.upstream.gameDataFailure = failure;
    try {
      engine.updateCheck("1.0.1:def", "loc-1", false);
      fail("Expected the update to fail.");
    } catch (UpstreamException e) {
      assertSame(failure, e);
    }
    assertSame(before, engine.getVersionState());
    assertSame(tablesBefore, engine.getLookupTables());
    assertEquals(TrackState.STALE, engine.getTrackState(Track.GAME_DATA));
    assertEquals("1.0.0:abc", this.store.read(
        VersionRecord.GAME_DATA_VERSION, VersionRecord.class).versionString);
  }

  @Test
  public void testUpdateCheckAsksUpstreamForMissingVersions()
      throws Exception {
    this.upstream.metadata = new Metadata("3.1.4:xyz", "loc-3");
    SyncEngine engine = engine();
    VersionState state = engine.updateCheck(null, null, false);
    assertEquals(1, this.upstream.metadataCalls);
    assertEquals("3.1.4:xyz", state.getGameDataVersion());
    assertEquals("loc-3", state.getLocalizationVersion());
  }

  @Test
  public void testResynchronizeForcesUpdate() throws Exception {
    SyncEngine engine = engine();
    engine.updateCheck("1.0.0:abc", "loc-1", false);
    engine.resynchronize();
    assertEquals(2, this.upstream.gameDataCalls);
    assertEquals(2, this.upstream.localizationCalls);
    assertEquals("1.0.0:abc", engine.getVersionState().getGameDataVersion());
  }

  @Test
  public void testInitLoadsStoredState() throws Exception {
    engine().updateCheck("1.0.0:abc", "loc-1", false);
    int gameDataCalls = this.upstream.gameDataCalls;
    SyncEngine restarted = engine();
    VersionState state = restarted.init();
    assertEquals(gameDataCalls, this.upstream.gameDataCalls);
    assertEquals("1.0.0:abc", state.getGameDataVersion());
    assertEquals("loc-1", state.getLocalizationVersion());
    assertThat(state.getKnownCollections(),
        containsInAnyOrder("units", "equipment"));
    assertEquals("Hello", restarted.getLanguage("ENG_US").get("KEY_A"));
    assertEquals("UNIT_VADER_NAME", restarted.getLookupTables().getUnits()
        .get("VADER").getNameKey());
  }

  @Test
  public void testInitWithoutStoredStateForcesUpdate() throws Exception {
    SyncEngine engine = engine();
    VersionState state = engine.init();
    assertEquals(1, this.upstream.metadataCalls);
    assertEquals(1, this.upstream.gameDataCalls);
    assertEquals("1.0.0:abc", state.getGameDataVersion());
  }

  @Test
  public void testInitWithStaleLanguageForcesUpdate() throws Exception {
    engine().updateCheck("1.0.0:abc", "loc-1", false);
    this.store.write("ENG_US", new VersionedDocument<>("loc-0",
        new LinkedHashMap<String, String>()));
    engine().init();
    assertEquals(2, this.upstream.gameDataCalls);
  }

  @Test
  public void testInterruptedTableWriteIsRepairedOnRestart()
      throws Exception {
    engine().updateCheck("1.0.0:abc", "loc-1", false);
    Map<String, JsonNode> newer = new LinkedHashMap<>();
    newer.put("units", json("[{'baseId':'YODA','obtainable':true,"
        + "'rarity':7,'nameKey':'UNIT_YODA_NAME','combatType':1}]"));
    this.upstream.gameData.put(null, newer);
    this.store.failingDocument = LookupTables.SKILL_MAP;
    try {
      engine().updateGameData("2.0.0:def");
      fail("Expected the table write to fail.");
    } catch (StoreException e) {
      assertEquals(LookupTables.SKILL_MAP, e.getName());
    }
    assertEquals("1.0.0:abc", this.store.read(
        VersionRecord.GAME_DATA_VERSION, VersionRecord.class).versionString);
    this.store.failingDocument = null;
    this.upstream.metadata = new Metadata("2.0.0:def", "loc-1");
    SyncEngine restarted = engine();
    VersionState state = restarted.init();
    assertEquals(3, this.upstream.gameDataCalls);
    assertEquals("2.0.0:def", state.getGameDataVersion());
    assertTrue(restarted.getLookupTables().getUnits().containsKey("YODA"));
    assertFalse(restarted.getLookupTables().getUnits().containsKey("VADER"));
  }

  @Test
  public void testInitRebuildsTablesFromRecordedCollections()
      throws Exception {
    engine().updateCheck("1.0.0:abc", "loc-1", false);
    this.store.write(LookupTables.UNIT_MAP,
        new LinkedHashMap<String, Object>());
    SyncEngine restarted = engine();
    restarted.init();
    assertEquals(1, this.upstream.gameDataCalls);
    assertEquals("UNIT_VADER_NAME", restarted.getLookupTables().getUnits()
        .get("VADER").getNameKey());
  }
}
