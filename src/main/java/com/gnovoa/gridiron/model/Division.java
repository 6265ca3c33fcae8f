package com.gnovoa.gridiron.model;

/** Division inside a conference. The ordinal is the index used by the schedule rotation tables. */
public enum Division {
  EAST,
  NORTH,
  SOUTH,
  WEST
}
