package com.example.lifegarden.util;

public record WateringRecord(boolean accepted, boolean alreadyWateredToday) {
  public static WateringRecord recorded() {
    return new WateringRecord(true, false);
  }

  public static WateringRecord duplicate() {
    return new WateringRecord(false, true);
  }
}
