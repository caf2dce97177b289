/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import org.fakehelp.mirror.upstream.LocalizationBundle;
import org.fakehelp.mirror.upstream.Metadata;
import org.fakehelp.mirror.upstream.Segment;
import org.fakehelp.mirror.upstream.UpstreamClient;
import org.fakehelp.mirror.upstream.UpstreamException;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream serving canned game data and counting requests.
 */
class FakeUpstreamClient implements UpstreamClient {

  Metadata metadata = new Metadata("1.0.0:abc", "loc-1");

  /** Collections by segment, with key {@code null} for whole mode. */
  final Map<Integer, Map<String, JsonNode>> gameData = new HashMap<>();

  final List<Segment> segments = new ArrayList<>();

  final List<Integer> requestedSegments = new ArrayList<>();

  LocalizationBundle bundle = LocalizationBundle.ofFiles(
      new LinkedHashMap<>());

  UpstreamException gameDataFailure;

  int metadataCalls;

  int gameDataCalls;

  int localizationCalls;

  @Override
  public Metadata getMetadata() {
    this.metadataCalls++;
    return this.metadata;
  }

  @Override
  public Map<String, JsonNode> getGameData(String version,
      boolean includePveUnits, Integer segment) throws UpstreamException {
    this.gameDataCalls++;
    this.requestedSegments.add(segment);
    if (null != this.gameDataFailure) {
      throw this.gameDataFailure;
    }
    Map<String, JsonNode> collections = this.gameData.get(segment);
    return null == collections ? new LinkedHashMap<>() : collections;
  }

  @Override
  public LocalizationBundle getLocalizationBundle(String version,
      boolean unzip) {
    this.localizationCalls++;
    return this.bundle;
  }

  @Override
  public JsonNode getPlayer(String allyCode, String playerId) {
    throw new UnsupportedOperationException();
  }

  @Override
  public JsonNode getGuild(String guildId,
      boolean includeRecentTerritoryWarResult) {
    throw new UnsupportedOperationException();
  }

  @Override
  public JsonNode getEvents() {
    throw new UnsupportedOperationException();
  }

  @Override
  public List<Segment> getSegmentEnum() {
    return this.segments;
  }
}
