/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.sync;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Versions of the locally stored game data and localization, together with
 * the names of the collections stored for that game-data version.
 *
 * <p>Instances are immutable and replaced as a whole after each successful
 * update.</p>
 */
public final class VersionState {

  private static final VersionState EMPTY = new VersionState(null, null,
      Collections.emptySet());

  private final String gameDataVersion;

  private final String localizationVersion;

  private final Set<String> knownCollections;

  /** Create a new state from the given versions and collection names. */
  public VersionState(String gameDataVersion, String localizationVersion,
      Collection<String> knownCollections) {
    this.gameDataVersion = gameDataVersion;
    this.localizationVersion = localizationVersion;
    this.knownCollections = Collections.unmodifiableSet(
        new LinkedHashSet<>(knownCollections));
  }

  /** State before anything was loaded or fetched. */
  public static VersionState empty() {
    return EMPTY;
  }

  public String getGameDataVersion() {
    return this.gameDataVersion;
  }

  public String getLocalizationVersion() {
    return this.localizationVersion;
  }

  public Set<String> getKnownCollections() {
    return this.knownCollections;
  }

  /** Copy of this state with new game-data version and collections. */
  VersionState withGameData(String version, Collection<String> collections) {
    return new VersionState(version, this.localizationVersion, collections);
  }

  /** Copy of this state with a new localization version. */
  VersionState withLocalization(String version) {
    return new VersionState(this.gameDataVersion, version,
        this.knownCollections);
  }

  @Override
  public String toString() {
    return "Game: " + this.gameDataVersion + ", Localization: "
        + this.localizationVersion + ", Collections: "
        + this.knownCollections.size();
  }
}
