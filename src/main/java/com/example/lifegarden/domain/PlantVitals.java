package com.example.lifegarden.domain;

import com.example.lifegarden.util.PlantState;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The watering-derived fields of a plant. They are always written together.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class PlantVitals {
  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private PlantHealth health = PlantHealth.HEALTHY;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private PlantSize size = PlantSize.SMALL;

  @Column(nullable = false)
  private int growthStage = 1;

  @Column(nullable = false)
  private int waterStreak;

  @Column(nullable = false)
  private int daysWithoutWater;

  @Column(nullable = false)
  private int totalWaterCount;

  public static PlantVitals of(PlantState state) {
    PlantVitals vitals = new PlantVitals();
    vitals.apply(state);
    return vitals;
  }

  public void apply(PlantState state) {
    this.health = state.health();
    this.size = state.size();
    this.growthStage = state.growthStage();
    this.waterStreak = state.waterStreak();
    this.daysWithoutWater = state.daysWithoutWater();
    this.totalWaterCount = state.totalWaterCount();
  }

  public PlantState toState() {
    return new PlantState(health, size, growthStage, waterStreak, daysWithoutWater, totalWaterCount);
  }
}
