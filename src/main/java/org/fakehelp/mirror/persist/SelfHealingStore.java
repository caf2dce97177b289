/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

import org.fakehelp.mirror.upstream.UpstreamException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads game-data collections and repairs them on the fly.
 *
 * <p>A collection that cannot be read, or that was stored for another
 * version than expected, triggers exactly one forced synchronization
 * followed by one more read. If that read fails or is still stale, the
 * collection is reported as unavailable; there is no second
 * synchronization.</p>
 */
public class SelfHealingStore {

  private static final Logger logger = LoggerFactory.getLogger(
      SelfHealingStore.class);

  private static final TypeReference<VersionedDocument<JsonNode>>
      COLLECTION_TYPE = new TypeReference<VersionedDocument<JsonNode>>() {};

  private final DataStore store;

  private final Resynchronizer resynchronizer;

  public SelfHealingStore(DataStore store, Resynchronizer resynchronizer) {
    this.store = store;
    this.resynchronizer = resynchronizer;
  }

  /**
   * Return the data of the given collection as stored for the expected
   * version.
   *
   * @param collection Collection name.
   * @param expectedVersion Game-data version the collection must carry.
   * @return Stored collection data.
   * @throws CollectionUnavailableException Thrown if the collection is
   *     missing, broken, or stale even after a forced synchronization.
   * @throws UpstreamException Thrown if the forced synchronization fails
   *     while talking to the upstream service.
   */
  public JsonNode readValidated(String collection, String expectedVersion)
      throws CollectionUnavailableException, UpstreamException {
    return this.readValidated(collection, expectedVersion, false);
  }

  private JsonNode readValidated(String collection, String expectedVersion,
      boolean retry) throws CollectionUnavailableException,
      UpstreamException {
    Exception cause = null;
    try {
      VersionedDocument<JsonNode> document
          = this.store.read(collection, COLLECTION_TYPE);
      if (document.hasVersion(expectedVersion)) {
        return document.getData();
      }
      logger.debug("Collection {} has version {}, expected {}.", collection,
          document.getVersion(), expectedVersion);
    } catch (StoreException e) {
      cause = e;
    }
    if (retry) {
      throw new CollectionUnavailableException(collection, cause);
    }
    logger.warn("There was an error reading {}, attempting to update game "
        + "data to resolve the error...", collection);
    try {
      this.resynchronizer.resynchronize();
    } catch (StoreException e) {
      throw new CollectionUnavailableException(collection, e);
    }
    return this.readValidated(collection, expectedVersion, true);
  }
}
