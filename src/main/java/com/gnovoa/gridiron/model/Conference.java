package com.gnovoa.gridiron.model;

public enum Conference {
  AFC,
  NFC;

  public Conference other() {
    return this == AFC ? NFC : AFC;
  }
}
