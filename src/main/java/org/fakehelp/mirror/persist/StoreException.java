/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

/** Failure reading or writing a stored document. */
public class StoreException extends Exception {

  /** What went wrong. */
  public enum Kind {
    NOT_FOUND,
    PARSE_ERROR,
    IO_ERROR
  }

  private final Kind kind;

  private final String name;

  public StoreException(Kind kind, String name, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = kind;
    this.name = name;
  }

  public Kind getKind() {
    return this.kind;
  }

  /** Name of the document concerned. */
  public String getName() {
    return this.name;
  }

}
