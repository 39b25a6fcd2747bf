package com.example.lifegarden.util;

import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.domain.PlantSize;

public record PlantState(PlantHealth health,
                         PlantSize size,
                         int growthStage,
                         int waterStreak,
                         int daysWithoutWater,
                         int totalWaterCount) {
  public PlantState {
    if (health == null || size == null) {
      throw new IllegalArgumentException("Plant health and size are required");
    }
    if (growthStage < 1 || growthStage > 5) {
      throw new IllegalArgumentException("Growth stage must be within 1..5: " + growthStage);
    }
    if (waterStreak < 0 || daysWithoutWater < 0 || totalWaterCount < 0) {
      throw new IllegalArgumentException("Watering counters must not be negative");
    }
  }
}
