package com.example.lifegarden.util;

import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.domain.PlantSize;
import com.example.lifegarden.domain.PlantVitals;

import java.time.LocalDate;

public record PlantStatus(Long id,
                          String name,
                          String arealId,
                          PlantHealth health,
                          PlantSize size,
                          int growthStage,
                          int waterStreak,
                          int daysWithoutWater,
                          int totalWaterCount,
                          LocalDate lastWatered) {
  public static PlantStatus of(Plant plant) {
    PlantVitals vitals = plant.getVitals();
    return new PlantStatus(plant.getId(),
        plant.getName(),
        plant.getAreal() == null ? null : plant.getAreal().getId(),
        vitals.getHealth(),
        vitals.getSize(),
        vitals.getGrowthStage(),
        vitals.getWaterStreak(),
        vitals.getDaysWithoutWater(),
        vitals.getTotalWaterCount(),
        plant.getLastWatered());
  }
}
