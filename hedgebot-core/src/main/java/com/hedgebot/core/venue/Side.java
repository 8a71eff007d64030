package com.hedgebot.core.venue;

public enum Side {
  BACK,
  LAY;

  public Side opposite() {
    return this == BACK ? LAY : BACK;
  }
}
