package com.example.lifegarden.api.dto;

import com.example.lifegarden.domain.PlantHealth;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public class GardenDtos {

  public record CreateArealRequest(
      @NotBlank String id,
      @NotBlank String name,
      String horizontalPos,
      String verticalPos,
      String size
  ) {}

  /** {@code health} defaults to healthy when absent */
  public record AddPlantRequest(
      @NotBlank String name,
      PlantHealth health,
      String imagePath,
      String position
  ) {}

  /** {@code date} defaults to today; {@code plants} holds plant names or ids */
  public record WaterRequest(
      LocalDate date,
      @NotNull List<String> plants
  ) {}

  public record DailyLimitRequest(
      @NotNull Integer maxPlantsPerDay
  ) {}

  public record DailyLimitResponse(
      int maxPlantsPerDay
  ) {}
}
