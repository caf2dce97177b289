/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.query;

import org.fakehelp.mirror.cache.TtlCache;
import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.ConfigurationException;
import org.fakehelp.mirror.conf.Key;
import org.fakehelp.mirror.fetch.FetchOrchestrator;
import org.fakehelp.mirror.lookup.LookupTables;
import org.fakehelp.mirror.persist.CollectionUnavailableException;
import org.fakehelp.mirror.persist.SelfHealingStore;
import org.fakehelp.mirror.persist.StoreException;
import org.fakehelp.mirror.sync.SyncEngine;
import org.fakehelp.mirror.sync.VersionState;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.NotInGuildException;
import org.fakehelp.mirror.upstream.UpstreamClient;
import org.fakehelp.mirror.upstream.UpstreamException;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers read requests from stored game data, the localization maps, and,
 * for players, guilds and events, the upstream service.
 *
 * <p>Player records are cached under both their ally code and their player
 * id for the configured time. Batches of players and guilds are fetched
 * with bounded concurrency and succeed if at least one item does.</p>
 */
public class MirrorService {

  private static final Logger logger = LoggerFactory.getLogger(
      MirrorService.class);

  /** Game-data versions carry the client version after the build number. */
  private static final Pattern GAME_DATA_VERSION
      = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+:(.*)");

  /** Collections may be requested with a legacy "List" suffix. */
  private static final Pattern LIST_SUFFIX = Pattern.compile("^(.*)List$");

  private final UpstreamClient client;

  private final SyncEngine engine;

  private final SelfHealingStore store;

  private final FetchOrchestrator orchestrator;

  private final TtlCache<JsonNode> playerCache;

  private final int concurrentPlayers;

  private final int concurrentGuilds;

  /**
   * Create a service with limits and cache time taken from the given
   * configuration.
   */
  public MirrorService(Configuration conf, UpstreamClient client,
      SyncEngine engine, SelfHealingStore store)
      throws ConfigurationException {
    this(client, engine, store, new FetchOrchestrator(),
        new TtlCache<>(conf.getLong(Key.PlayerCacheTimeMillis)),
        conf.getInt(Key.ConcurrentPlayers), conf.getInt(Key.ConcurrentGuilds));
  }

  /** Create a service from explicit parts. */
  public MirrorService(UpstreamClient client, SyncEngine engine,
      SelfHealingStore store, FetchOrchestrator orchestrator,
      TtlCache<JsonNode> playerCache, int concurrentPlayers,
      int concurrentGuilds) {
    this.client = client;
    this.engine = engine;
    this.store = store;
    this.orchestrator = orchestrator;
    this.playerCache = playerCache;
    this.concurrentPlayers = concurrentPlayers;
    this.concurrentGuilds = concurrentGuilds;
  }

  public TtlCache<JsonNode> getPlayerCache() {
    return this.playerCache;
  }

  public LookupTables getLookupTables() {
    return this.engine.getLookupTables();
  }

  /**
   * Return the stored records of the given collection for the current
   * game-data version.
   *
   * @param collection Collection name, with or without a trailing
   *     {@code List}.
   * @throws IllegalArgumentException Thrown if no such collection is known
   *     for the current game-data version.
   */
  public JsonNode getGameData(String collection)
      throws CollectionUnavailableException, UpstreamException {
    String name = collection;
    Matcher matcher = LIST_SUFFIX.matcher(collection);
    if (matcher.matches()) {
      name = matcher.group(1);
    }
    VersionState state = this.engine.getVersionState();
    if (!state.getKnownCollections().contains(name)) {
      throw new IllegalArgumentException(collection
          + " is not a valid game data collection");
    }
    return this.store.readValidated(name, state.getGameDataVersion());
  }

  /**
   * Return the player records of the given ally codes.
   *
   * @throws IllegalArgumentException Thrown if no ally code is given.
   * @throws UpstreamException First failure, if no player could be fetched.
   */
  public List<JsonNode> getPlayers(List<String> allyCodes)
      throws UpstreamException, InterruptedException {
    requireAllyCodes(allyCodes);
    return this.orchestrator.fetchAll(allyCodes, this.concurrentPlayers,
        allyCode -> this.cachedPlayer(allyCode, null));
  }

  /**
   * Return the guild records of the guilds the given ally codes belong to,
   * each with its members' player records.
   *
   * @throws IllegalArgumentException Thrown if no ally code is given.
   * @throws UpstreamException First failure, if no guild could be fetched;
   *     a {@link NotInGuildException} if that failure was a player without
   *     a guild.
   */
  public List<GuildRecord> getGuilds(List<String> allyCodes)
      throws UpstreamException, InterruptedException {
    requireAllyCodes(allyCodes);
    return this.orchestrator.fetchAll(allyCodes, this.concurrentGuilds,
        this::fetchGuild);
  }

  /** Return the currently scheduled events as reported by upstream. */
  public JsonNode getEvents() throws UpstreamException {
    return this.client.getEvents();
  }

  /**
   * Return the key/value map of the given language.
   *
   * @throws IllegalArgumentException Thrown if that language is not loaded.
   */
  public Map<String, String> getLanguage(String language) {
    Map<String, String> map = null == language ? null
        : this.engine.getLanguage(language);
    if (null == map) {
      throw new IllegalArgumentException("Unable to find language: "
          + language);
    }
    return map;
  }

  /**
   * Ask upstream for its latest versions, bring local data up to date, and
   * return the client version and localization version.
   */
  public VersionInfo getVersion() throws UpstreamException, StoreException {
    Metadata metadata = this.client.getMetadata();
    String gameDataVersion = metadata.getLatestGameDataVersion();
    String game = gameDataVersion;
    if (null != gameDataVersion) {
      Matcher matcher = GAME_DATA_VERSION.matcher(gameDataVersion);
      if (matcher.find()) {
        game = matcher.group(1);
      }
    }
    this.engine.updateCheck(gameDataVersion,
        metadata.getLatestLocalizationVersion(), false);
    return new VersionInfo(game, metadata.getLatestLocalizationVersion());
  }

  private static void requireAllyCodes(List<String> allyCodes) {
    if (null == allyCodes || allyCodes.isEmpty()) {
      throw new IllegalArgumentException("No ally code specified");
    }
  }

  private GuildRecord fetchGuild(String allyCode) throws UpstreamException {
    JsonNode player = this.cachedPlayer(allyCode, null);
    String guildId = player.path("guildId").asText("");
    if (guildId.isEmpty()) {
      throw new NotInGuildException(allyCode);
    }
    JsonNode response = this.client.getGuild(guildId, true);
    JsonNode guild = null == response ? null
        : response.has("guild") ? response.get("guild") : response;
    if (null == guild || guild.isNull()) {
      throw new UpstreamException(UpstreamException.Kind.NOT_FOUND,
          "No guild found for " + allyCode);
    }
    List<String> memberIds = new ArrayList<>();
    for (JsonNode member : guild.path("member")) {
      String playerId = member.path("playerId").asText("");
      if (!playerId.isEmpty()) {
        memberIds.add(playerId);
      }
    }
    logger.debug("Fetching {} members of guild {}.", memberIds.size(),
        guildId);
    try {
      List<JsonNode> members = this.orchestrator.fetchAll(memberIds,
          this.concurrentPlayers, playerId -> this.cachedPlayer(null,
          playerId));
      return new GuildRecord(response, members);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(UpstreamException.Kind.TRANSIENT,
          "Interrupted while fetching members of guild " + guildId, e);
    }
  }

  /**
   * Return the player from the cache, or fetch it and cache it under both
   * its ally code and player id.
   */
  private JsonNode cachedPlayer(String allyCode, String playerId)
      throws UpstreamException {
    JsonNode player = null != allyCode ? this.playerCache.get(allyCode)
        : this.playerCache.get(playerId);
    if (null != player) {
      return player;
    }
    player = this.client.getPlayer(allyCode, playerId);
    if (null == player) {
      throw new UpstreamException(UpstreamException.Kind.NOT_FOUND,
          "No player found for " + (null != allyCode ? allyCode : playerId));
    }
    this.playerCache.set(player.path("allyCode").asText(""), player);
    this.playerCache.set(player.path("playerId").asText(""), player);
    return player;
  }
}
