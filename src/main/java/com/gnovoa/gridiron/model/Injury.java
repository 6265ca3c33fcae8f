package com.gnovoa.gridiron.model;

public record Injury(String description, int weeksRemaining) {

  public static final Injury NONE = new Injury(null, 0);

  public boolean isInjured() {
    return weeksRemaining > 0;
  }
}
