/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

/**
 * Failure talking to the upstream game-data service.
 *
 * <p>The {@link Kind} lets a boundary layer tell domain-not-found outcomes
 * apart from generic upstream failures.</p>
 */
public class UpstreamException extends Exception {

  /** Classification of upstream failures. */
  public enum Kind {

    /** Network failure or timeout, worth retrying later. */
    TRANSIENT,

    /** Upstream answered with an error status. */
    SERVER_ERROR,

    /** Requested entity does not exist upstream. */
    NOT_FOUND,

    /** Anything else, including unexpected runtime failures. */
    UNEXPECTED
  }

  private final Kind kind;

  public UpstreamException(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  public UpstreamException(Kind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return this.kind;
  }

}
