package com.example.lifegarden.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlantSize {
  SMALL("small"),
  MEDIUM("medium"),
  BIG("big");

  private final String title;

  PlantSize(String title) {
    this.title = title;
  }

  @JsonValue
  public String getTitle() {
    return title;
  }

  public PlantSize atMost(PlantSize cap) {
    return ordinal() > cap.ordinal() ? cap : this;
  }
}
