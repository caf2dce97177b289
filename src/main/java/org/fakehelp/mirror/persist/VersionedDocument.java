/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Data tagged with the version it was fetched for.
 *
 * <p>A stored document is only valid while its version equals the version
 * currently expected for it.</p>
 *
 * @param <T> Type of the contained data.
 */
@JsonPropertyOrder({ "version", "data" })
@JsonIgnoreProperties(ignoreUnknown = true)
public class VersionedDocument<T> {

  @JsonProperty("version")
  private String version;

  @JsonProperty("data")
  private T data;

  /** Used by Jackson. */
  VersionedDocument() {
  }

  public VersionedDocument(String version, T data) {
    this.version = version;
    this.data = data;
  }

  public String getVersion() {
    return this.version;
  }

  public T getData() {
    return this.data;
  }

  /** Whether this document was stored for the given version. */
  public boolean hasVersion(String expectedVersion) {
    return null != this.version && this.version.equals(expectedVersion);
  }
}
