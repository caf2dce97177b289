/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

/** Thrown if a player exists but is not a member of any guild. */
public class NotInGuildException extends UpstreamException {

  private final String allyCode;

  public NotInGuildException(String allyCode) {
    super(Kind.NOT_FOUND, allyCode + " is not in a guild");
    this.allyCode = allyCode;
  }

  public String getAllyCode() {
    return this.allyCode;
  }

}
