package com.example.lifegarden.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PlantHealth {
  DEAD("dead"),
  OKAY("okay"),
  HEALTHY("healthy");

  private final String title;

  PlantHealth(String title) {
    this.title = title;
  }

  @JsonValue
  public String getTitle() {
    return title;
  }

  @JsonCreator
  public static PlantHealth fromTitle(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Plant health is empty");
    }
    for (PlantHealth health : values()) {
      if (health.title.equalsIgnoreCase(value.trim()) || health.name().equalsIgnoreCase(value.trim())) {
        return health;
      }
    }
    throw new IllegalArgumentException("Unknown plant health: " + value);
  }
}
