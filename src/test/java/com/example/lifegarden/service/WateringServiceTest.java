package com.example.lifegarden.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lifegarden.config.GardenProperties;
import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.exception.InvalidConfigException;
import com.example.lifegarden.exception.UnknownPlantException;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.util.PlantState;
import com.example.lifegarden.util.PlantStatus;
import com.example.lifegarden.util.WateringResult;
import com.example.lifegarden.util.WateringStats;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({
    WateringService.class,
    WateringLedger.class,
    WateringAdmissionService.class,
    GardenProgressionService.class,
    PlantStateCalculator.class,
    GardenService.class,
    WateringServiceTest.FixedClockConfig.class
})
class WateringServiceTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  @TestConfiguration
  static class FixedClockConfig {
    @Bean
    Clock gardenClock() {
      return Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
    }

    @Bean
    GardenProperties gardenProperties() {
      return new GardenProperties(4, "UTC", null, false);
    }
  }

  @Autowired
  WateringService wateringService;

  @Autowired
  GardenService gardenService;

  @Autowired
  PlantRepository plantRepository;

  @BeforeEach
  void setUp() {
    gardenService.createAreal("family", "Family", "left", "top", "big");
    gardenService.createAreal("sport", "Sport", "right", "top", "medium");
    gardenService.addPlant("family", "Call parents", PlantHealth.HEALTHY, "rose.png", "1");
    gardenService.addPlant("family", "Dinner together", PlantHealth.OKAY, "tulip.png", "2");
    gardenService.addPlant("sport", "Running", PlantHealth.HEALTHY, "cactus.png", "1");
    gardenService.addPlant("sport", "Swimming", PlantHealth.DEAD, "fern.png", "2");
    gardenService.addPlant("sport", "Yoga", PlantHealth.HEALTHY, "bonsai.png", "3");
  }

  @Nested
  @DisplayName("Watering plants")
  class WateringPlants {

    @Test
    @DisplayName("Limit 4, 2 watered already, 3 new requested: 2 watered, 1 rejected, nothing left")
    void capacityScenario() {
      wateringService.waterPlants(TODAY, List.of("Call parents", "Running"));

      WateringResult result = wateringService.waterPlants(TODAY, List.of("Swimming", "Yoga", "Dinner together"));

      assertThat(result.watered()).extracting(PlantStatus::name).containsExactly("Swimming", "Yoga");
      assertThat(result.rejectedDueToCapacity()).containsExactly("Dinner together");
      assertThat(result.remainingCapacity()).isZero();
      assertThat(result.wateredToday()).isEqualTo(4);
      assertThat(result.dailyLimit()).isEqualTo(4);
    }

    @Test
    @DisplayName("Unknown names are reported while the rest of the batch is watered")
    void unknownPlantsAreSkipped() {
      WateringResult result = wateringService.waterPlants(TODAY, List.of("Chess", "Running"));

      assertThat(result.unknown()).containsExactly("Chess");
      assertThat(result.watered()).extracting(PlantStatus::name).containsExactly("Running");
    }

    @Test
    @DisplayName("Watering the same plant twice a day is reported, not counted twice")
    void duplicateWateringIsReported() {
      WateringResult first = wateringService.waterPlants(TODAY, List.of("Running"));
      WateringResult second = wateringService.waterPlants(TODAY, List.of("Running", "Running"));

      assertThat(second.watered()).isEmpty();
      assertThat(second.alreadyWatered()).containsExactly("Running");
      assertThat(second.wateredToday()).isEqualTo(1);
      assertThat(second.remainingCapacity()).isEqualTo(3);
      assertThat(first.watered().get(0).waterStreak()).isEqualTo(1);
    }

    @Test
    @DisplayName("Plants can be addressed by id")
    void waterById() {
      Long id = gardenService.getPlantsByHealth(PlantHealth.DEAD).get(0).id();

      WateringResult result = wateringService.waterPlants(TODAY, List.of(String.valueOf(id)));

      assertThat(result.watered()).extracting(PlantStatus::name).containsExactly("Swimming");
    }

    @Test
    @DisplayName("Dates in the future are rejected")
    void futureDateRejected() {
      assertThatThrownBy(() -> wateringService.waterPlants(TODAY.plusDays(1), List.of("Running")))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Watering dated before a plant's last evaluation is reported and leaves no trace")
    void wateringBeforeLastEvaluationIsNotRecorded() {
      PlantState before = plantRepository.findByName("Running").orElseThrow().getVitals().toState();

      WateringResult result = wateringService.waterPlants(TODAY.minusDays(3), List.of("Running", "Chess"));

      assertThat(result.watered()).isEmpty();
      assertThat(result.alreadyEvaluated()).containsExactly("Running");
      assertThat(result.unknown()).containsExactly("Chess");
      assertThat(result.wateredToday()).isZero();
      assertThat(result.remainingCapacity()).isEqualTo(4);
      assertThat(wateringService.getWateringHistory(null, 10)).isEmpty();
      assertThat(plantRepository.findByName("Running").orElseThrow().getVitals().toState()).isEqualTo(before);
      assertThat(plantRepository.findByName("Running").orElseThrow().getLastWatered()).isNull();
    }

    @Test
    @DisplayName("Watering on the last evaluated date itself still counts")
    void wateringOnLastEvaluatedDate() {
      WateringResult result = wateringService.waterPlants(TODAY.minusDays(1), List.of("Running"));

      assertThat(result.alreadyEvaluated()).isEmpty();
      assertThat(result.watered()).extracting(PlantStatus::name).containsExactly("Running");
      assertThat(result.watered().get(0).totalWaterCount()).isEqualTo(1);
      assertThat(result.watered().get(0).lastWatered()).isEqualTo(TODAY.minusDays(1));
    }

    @Test
    @DisplayName("Watering a single unknown plant fails")
    void singleUnknownPlant() {
      assertThatThrownBy(() -> wateringService.waterSinglePlant(TODAY, "Chess"))
          .isInstanceOf(UnknownPlantException.class);
    }

    @Test
    @DisplayName("Watering a single plant uses the same capacity rules")
    void singlePlant() {
      WateringResult result = wateringService.waterSinglePlant(null, "Yoga");

      assertThat(result.date()).isEqualTo(TODAY);
      assertThat(result.watered()).extracting(PlantStatus::name).containsExactly("Yoga");
      assertThat(result.remainingCapacity()).isEqualTo(3);
    }
  }

  @Nested
  @DisplayName("Stats and limit")
  class StatsAndLimit {

    @Test
    @DisplayName("Stats list today's watered plants and the plants needing water, most urgent first")
    void stats() {
      wateringService.waterPlants(TODAY, List.of("Running"));

      WateringStats stats = wateringService.getWateringStats(TODAY);

      assertThat(stats.maxPerDay()).isEqualTo(4);
      assertThat(stats.wateredToday()).isEqualTo(1);
      assertThat(stats.remaining()).isEqualTo(3);
      assertThat(stats.wateredPlants()).containsExactly("Running");
      assertThat(stats.plantsNeedingWater()).extracting(PlantStatus::name)
          .containsExactly("Swimming", "Dinner together");
    }

    @Test
    @DisplayName("Out of range limit is rejected and the old limit stays")
    void invalidLimit() {
      assertThatThrownBy(() -> wateringService.updateDailyLimit(51)).isInstanceOf(InvalidConfigException.class);

      assertThat(wateringService.getWateringStats(TODAY).maxPerDay()).isEqualTo(4);
    }

    @Test
    @DisplayName("Raised limit admits more plants the same day")
    void raisedLimit() {
      wateringService.updateDailyLimit(1);
      WateringResult capped = wateringService.waterPlants(TODAY, List.of("Running", "Yoga"));
      assertThat(capped.rejectedDueToCapacity()).containsExactly("Yoga");

      wateringService.updateDailyLimit(5);
      WateringResult retried = wateringService.waterPlants(TODAY, List.of("Yoga"));

      assertThat(retried.watered()).extracting(PlantStatus::name).containsExactly("Yoga");
      assertThat(retried.remainingCapacity()).isEqualTo(3);
    }

    @Test
    @DisplayName("History lists today's waterings")
    void history() {
      wateringService.waterPlants(TODAY, List.of("Running", "Yoga"));

      assertThat(wateringService.getWateringHistory(null, 10)).hasSize(2);
    }
  }
}
