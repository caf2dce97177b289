/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

/**
 * One entry of the upstream's game-data segment enumeration.
 */
public final class Segment {

  private final String name;

  private final int id;

  public Segment(String name, int id) {
    this.name = name;
    this.id = id;
  }

  public String getName() {
    return this.name;
  }

  public int getId() {
    return this.id;
  }

  @Override
  public String toString() {
    return this.name + "(" + this.id + ")";
  }
}
