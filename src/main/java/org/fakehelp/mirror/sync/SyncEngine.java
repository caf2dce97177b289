/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.ConfigurationException;
import org.fakehelp.mirror.conf.Key;
import org.fakehelp.mirror.lookup.LookupTableBuilder;
import org.fakehelp.mirror.lookup.LookupTables;
import org.fakehelp.mirror.persist.DataStore;
import org.fakehelp.mirror.persist.Resynchronizer;
import org.fakehelp.mirror.persist.StoreException;
import org.fakehelp.mirror.persist.VersionedDocument;
import org.fakehelp.mirror.upstream.LocalizationBundle;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.Segment;
import org.fakehelp.mirror.upstream.UpstreamClient;
import org.fakehelp.mirror.upstream.UpstreamException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the locally stored game data and localization in line with the
 * versions announced by the upstream service.
 *
 * <p>Game data and localization are tracked independently. A track is
 * updated if forced, or if the remote version differs in any way from the
 * recorded one, or, for game data, if no collections are known. An update
 * replaces the in-memory {@link VersionState} only after everything was
 * fetched and stored; a failing update leaves the previous state in place
 * and the error goes to the caller.</p>
 *
 * <p>All updates are serialized on this instance.</p>
 */
public class SyncEngine implements Resynchronizer {

  private static final Logger logger = LoggerFactory.getLogger(
      SyncEngine.class);

  private static final boolean INCLUDE_PVE_UNITS = true;

  private static final TypeReference<VersionedDocument<JsonNode>>
      COLLECTION_TYPE = new TypeReference<VersionedDocument<JsonNode>>() {};

  private static final TypeReference<VersionedDocument<Map<String, String>>>
      LANGUAGE_TYPE
      = new TypeReference<VersionedDocument<Map<String, String>>>() {};

  private final UpstreamClient client;

  private final DataStore store;

  private final Set<String> languages;

  private final boolean noLocalization;

  private final boolean useSegments;

  private final boolean useUnzip;

  private final Map<Track, TrackState> trackStates
      = Collections.synchronizedMap(new EnumMap<>(Track.class));

  private volatile VersionState versionState = VersionState.empty();

  private volatile LookupTables lookupTables = LookupTables.empty();

  private volatile Map<String, Map<String, String>> languageMaps
      = Collections.emptyMap();

  /**
   * Create an engine storing into the given store.
   *
   * @param conf Configuration providing languages and fetch modes.
   * @param client Upstream client to fetch from.
   * @param store Store to persist into.
   * @throws ConfigurationException Thrown if a setting is invalid.
   */
  public SyncEngine(Configuration conf, UpstreamClient client,
      DataStore store) throws ConfigurationException {
    this.client = client;
    this.store = store;
    Set<String> allowed = new LinkedHashSet<>();
    for (String language : conf.getStringArray(Key.Languages)) {
      if (!language.isEmpty()) {
        allowed.add(language.toUpperCase(Locale.ROOT));
      }
    }
    this.languages = Collections.unmodifiableSet(allowed);
    this.noLocalization = conf.getBool(Key.NoLocalization);
    this.useSegments = conf.getBool(Key.UseSegments);
    this.useUnzip = conf.getBool(Key.UseUnzip);
    this.trackStates.put(Track.GAME_DATA, TrackState.STALE);
    this.trackStates.put(Track.LOCALIZATION, TrackState.STALE);
  }

  public VersionState getVersionState() {
    return this.versionState;
  }

  public LookupTables getLookupTables() {
    return this.lookupTables;
  }

  public TrackState getTrackState(Track track) {
    return this.trackStates.get(track);
  }

  /**
   * Return the key/value map of the given language, or {@code null} if that
   * language is not loaded.
   */
  public Map<String, String> getLanguage(String language) {
    return this.languageMaps.get(language.toUpperCase(Locale.ROOT));
  }

  /**
   * Load versions, lookup tables, and languages stored by a previous run,
   * or run a forced update if any of them is missing, broken, or does not
   * match the recorded versions.
   */
  public synchronized VersionState init()
      throws UpstreamException, StoreException {
    logger.info("Loading and verifying game data...");
    try {
      this.loadStoredState();
      logger.info("Loaded stored data. {}", this.versionState);
      return this.versionState;
    } catch (StoreException e) {
      logger.info("Encountered an error loading the version data: {} "
          + "Forcing an update.", e.getMessage());
      return this.updateCheck(null, null, true);
    }
  }

  private void loadStoredState() throws StoreException {
    VersionRecord gameRecord = this.store.read(
        VersionRecord.GAME_DATA_VERSION, VersionRecord.class);
    String localizationVersion = null;
    Map<String, Map<String, String>> loadedLanguages = new HashMap<>();
    if (!this.noLocalization) {
      VersionRecord localizationRecord = this.store.read(
          VersionRecord.LOCALIZATION_VERSION, VersionRecord.class);
      localizationVersion = localizationRecord.versionString;
      Set<String> stored = new LinkedHashSet<>(this.languages);
      if (null != localizationRecord.files) {
        stored.retainAll(localizationRecord.files);
      }
      for (String language : stored) {
        logger.debug("Reading language data file: {}", language);
        VersionedDocument<Map<String, String>> document
            = this.store.read(language, LANGUAGE_TYPE);
        if (!document.hasVersion(localizationVersion)) {
          throw new StoreException(StoreException.Kind.PARSE_ERROR, language,
              "Language data version mismatched: " + language, null);
        }
        loadedLanguages.put(language, document.getData());
      }
    }
    List<String> files = null == gameRecord.files
        ? Collections.emptyList() : gameRecord.files;
    /* Table files may stem from an interrupted update, so the tables are
     * rebuilt from the collections of the recorded version. */
    LookupTables tables = this.rebuildLookupTables(gameRecord.versionString,
        new LinkedHashSet<>(files));
    this.lookupTables = tables;
    this.languageMaps = Collections.unmodifiableMap(loadedLanguages);
    this.versionState = new VersionState(gameRecord.versionString,
        localizationVersion, files);
    this.trackStates.put(Track.GAME_DATA, TrackState.FRESH);
    this.trackStates.put(Track.LOCALIZATION, TrackState.FRESH);
  }

  /**
   * Decide whether the given track needs an update to reach the given
   * remote version. Versions are compared as plain strings, so any
   * difference including a downgrade counts.
   */
  public boolean needsUpdate(Track track, String remoteVersion,
      boolean force) {
    if (force) {
      return true;
    }
    VersionState state = this.versionState;
    if (Track.GAME_DATA == track) {
      return !equal(state.getGameDataVersion(), remoteVersion)
          || state.getKnownCollections().isEmpty();
    }
    return !equal(state.getLocalizationVersion(), remoteVersion);
  }

  private static boolean equal(String local, String remote) {
    return null != local && null != remote && local.equals(remote);
  }

  /**
   * Check for and run needed updates of both tracks.
   *
   * @param gameVersion Remote game-data version, or {@code null} to ask
   *     upstream.
   * @param localizationVersion Remote localization version, or {@code null}
   *     to ask upstream.
   * @param force Whether to ask upstream for versions and update both tracks
   *     regardless of recorded versions.
   * @return State after all updates.
   */
  public synchronized VersionState updateCheck(String gameVersion,
      String localizationVersion, boolean force)
      throws UpstreamException, StoreException {
    String game = gameVersion;
    String localization = localizationVersion;
    if (force || null == game || null == localization) {
      Metadata metadata = this.client.getMetadata();
      game = metadata.getLatestGameDataVersion();
      localization = metadata.getLatestLocalizationVersion();
    }
    if (this.needsUpdate(Track.GAME_DATA, game, force)) {
      this.updateGameData(game);
    }
    if (!this.noLocalization
        && this.needsUpdate(Track.LOCALIZATION, localization, force)) {
      this.updateLocalizationBundle(localization);
    }
    return this.versionState;
  }

  /** Update both tracks regardless of recorded versions. */
  @Override
  public void resynchronize() throws UpstreamException, StoreException {
    this.updateCheck(null, null, true);
  }

  /**
   * Fetch and store all game-data collections of the given version and
   * rebuild the lookup tables.
   */
  public synchronized VersionState updateGameData(String remoteVersion)
      throws UpstreamException, StoreException {
    this.trackStates.put(Track.GAME_DATA, TrackState.UPDATING);
    boolean updated = false;
    try {
      logger.info("Updating game data to version {}...", remoteVersion);
      Set<String> files = new LinkedHashSet<>();
      if (this.useSegments) {
        List<Segment> segments = this.client.getSegmentEnum();
        for (int i = 0; i < segments.size(); i++) {
          Segment segment = segments.get(i);
          if (i == segments.size() - 1) {
            /* The last enumerated segment is a sentinel. */
            logger.warn("Not fetching final segment {}.", segment);
            continue;
          }
          if (segment.getId() <= 0) {
            logger.debug("Not fetching segment {} without positive id.",
                segment);
            continue;
          }
          Map<String, JsonNode> gameData = this.client.getGameData(
              remoteVersion, INCLUDE_PVE_UNITS, segment.getId());
          for (String name : this.storeCollections(remoteVersion, gameData)) {
            logger.info("Found {} in segment {}.", name, segment);
            files.add(name);
          }
        }
      } else {
        logger.info("Fetching game data without using segments parameter.");
        files.addAll(this.storeCollections(remoteVersion,
            this.client.getGameData(remoteVersion, INCLUDE_PVE_UNITS, null)));
      }
      List<String> fileList = new ArrayList<>(files);
      LookupTables tables = this.rebuildLookupTables(remoteVersion, files);
      this.storeLookupTables(tables);
      /* The version record is written last and commits the update. */
      this.store.write(VersionRecord.GAME_DATA_VERSION,
          VersionRecord.of(remoteVersion, fileList));
      this.versionState = this.versionState.withGameData(remoteVersion,
          fileList);
      this.lookupTables = tables;
      updated = true;
      logger.info("Updated game data to version {} with {} collections.",
          remoteVersion, fileList.size());
      return this.versionState;
    } finally {
      this.trackStates.put(Track.GAME_DATA,
          updated ? TrackState.FRESH : TrackState.STALE);
    }
  }

  private List<String> storeCollections(String version,
      Map<String, JsonNode> gameData) throws StoreException {
    List<String> written = new ArrayList<>();
    for (Map.Entry<String, JsonNode> collection : gameData.entrySet()) {
      JsonNode data = collection.getValue();
      if (null == data || data.isNull()
          || (data.isContainerNode() && data.size() == 0)) {
        logger.debug("Skipping empty collection {}.", collection.getKey());
        continue;
      }
      this.store.write(collection.getKey(),
          new VersionedDocument<>(version, data));
      written.add(collection.getKey());
    }
    return written;
  }

  /**
   * Build new lookup tables from the collections just written. A source
   * collection that upstream did not deliver counts as empty; one that was
   * written but cannot be read back aborts the rebuild.
   */
  private LookupTables rebuildLookupTables(String version,
      Set<String> written) throws StoreException {
    Map<String, JsonNode> sources = new HashMap<>();
    for (String name : LookupTableBuilder.SOURCE_COLLECTIONS) {
      if (!written.contains(name)) {
        logger.warn("Collection {} missing in game data {}. Building lookup "
            + "tables without it.", name, version);
        sources.put(name, JsonNodeFactory.instance.arrayNode());
        continue;
      }
      VersionedDocument<JsonNode> document = this.store.read(name,
          COLLECTION_TYPE);
      if (!document.hasVersion(version)) {
        throw new StoreException(StoreException.Kind.PARSE_ERROR, name,
            "Collection " + name + " has version " + document.getVersion()
            + " instead of " + version + ".", null);
      }
      sources.put(name, document.getData());
    }
    return LookupTableBuilder.build(
        sources.get(LookupTableBuilder.UNITS),
        sources.get(LookupTableBuilder.SKILL),
        sources.get(LookupTableBuilder.ABILITY),
        sources.get(LookupTableBuilder.EQUIPMENT),
        sources.get(LookupTableBuilder.STAT_MOD));
  }

  private void storeLookupTables(LookupTables tables) throws StoreException {
    this.store.write(LookupTables.UNIT_MAP, tables.getUnits());
    this.store.write(LookupTables.EQUIP_MAP, tables.getEquipment());
    this.store.write(LookupTables.SKILL_MAP, tables.getSkills());
    this.store.write(LookupTables.MOD_MAP, tables.getMods());
  }

  /**
   * Fetch the localization bundle of the given version and store one
   * document per configured language. Does nothing if localization is
   * disabled.
   */
  public synchronized void updateLocalizationBundle(String remoteVersion)
      throws UpstreamException, StoreException {
    if (this.noLocalization) {
      logger.debug("Skipping localization, no localization enabled.");
      return;
    }
    this.trackStates.put(Track.LOCALIZATION, TrackState.UPDATING);
    boolean updated = false;
    try {
      logger.info("Updating localization to version {}...", remoteVersion);
      LocalizationBundle bundle = this.client.getLocalizationBundle(
          remoteVersion, this.useUnzip);
      Map<String, Map<String, String>> maps;
      try {
        maps = new LocalizationBundleReader(this.languages).read(bundle);
      } catch (IOException e) {
        throw new UpstreamException(UpstreamException.Kind.UNEXPECTED,
            "Cannot read localization bundle " + remoteVersion + ": "
            + e.getMessage(), e);
      }
      Set<String> missing = new TreeSet<>(this.languages);
      missing.removeAll(maps.keySet());
      if (!missing.isEmpty()) {
        logger.warn("Localization bundle {} lacks languages {}.",
            remoteVersion, missing);
      }
      for (Map.Entry<String, Map<String, String>> language
          : maps.entrySet()) {
        this.store.write(language.getKey(),
            new VersionedDocument<>(remoteVersion, language.getValue()));
      }
      this.store.write(VersionRecord.LOCALIZATION_VERSION,
          VersionRecord.of(remoteVersion, new ArrayList<>(maps.keySet())));
      this.languageMaps = Collections.unmodifiableMap(maps);
      this.versionState = this.versionState.withLocalization(remoteVersion);
      updated = true;
      logger.info("Updated localization to version {}.", remoteVersion);
    } finally {
      this.trackStates.put(Track.LOCALIZATION,
          updated ? TrackState.FRESH : TrackState.STALE);
    }
  }
}
