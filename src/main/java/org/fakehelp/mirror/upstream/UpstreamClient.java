/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Operations offered by the upstream game-data service.
 *
 * <p>Raw records are returned as Jackson trees; reshaping them is left to
 * the caller.</p>
 */
public interface UpstreamClient {

  /** Latest game-data and localization versions. */
  Metadata getMetadata() throws UpstreamException;

  /**
   * Game-data collections of the given version.
   *
   * @param version Game-data version to fetch.
   * @param includePveUnits Whether to include units only used in PvE.
   * @param segment Segment identifier, or {@code null} to fetch all
   *     collections at once.
   * @return Collection names mapped to arrays of raw records.
   */
  Map<String, JsonNode> getGameData(String version, boolean includePveUnits,
      Integer segment) throws UpstreamException;

  /**
   * Localization bundle of the given version, zipped unless {@code unzip}
   * is set.
   */
  LocalizationBundle getLocalizationBundle(String version, boolean unzip)
      throws UpstreamException;

  /**
   * Player record looked up by ally code or, if that is {@code null}, by
   * player id.
   */
  JsonNode getPlayer(String allyCode, String playerId)
      throws UpstreamException;

  /** Guild record of the given guild. */
  JsonNode getGuild(String guildId, boolean includeRecentTerritoryWarResult)
      throws UpstreamException;

  /** Currently scheduled game events. */
  JsonNode getEvents() throws UpstreamException;

  /** Ordered game-data segment enumeration. */
  List<Segment> getSegmentEnum() throws UpstreamException;

}
