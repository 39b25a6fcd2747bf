package com.example.lifegarden.service;

import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.exception.UnknownPlantException;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.util.AdmissionDecision;
import com.example.lifegarden.util.PlantStatus;
import com.example.lifegarden.util.WateringHistoryEntry;
import com.example.lifegarden.util.WateringRecord;
import com.example.lifegarden.util.WateringResult;
import com.example.lifegarden.util.WateringStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for callers that water plants and read the daily watering state.
 * <p>
 * Every call runs as one transaction under a process-wide lock, so concurrent batches for
 * the same day are applied one after another and a failed call leaves nothing behind.
 */
@Slf4j
@Service
public class WateringService {
  static final int NEEDS_WATER_DAYS = 2;

  private static final Comparator<PlantStatus> NEEDING_WATER_ORDER =
      Comparator.comparingInt(PlantStatus::daysWithoutWater).reversed()
          .thenComparingInt(status -> status.health() == PlantHealth.DEAD ? 0 : 1)
          .thenComparingInt(PlantStatus::waterStreak);

  private final PlantRepository plantRepository;
  private final WateringLedger wateringLedger;
  private final WateringAdmissionService admissionService;
  private final GardenProgressionService progressionService;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final Object wateringLock = new Object();

  public WateringService(PlantRepository plantRepository,
                         WateringLedger wateringLedger,
                         WateringAdmissionService admissionService,
                         GardenProgressionService progressionService,
                         TransactionTemplate transactionTemplate,
                         Clock clock) {
    this.plantRepository = plantRepository;
    this.wateringLedger = wateringLedger;
    this.admissionService = admissionService;
    this.progressionService = progressionService;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * Waters the plants named (or numbered) in {@code identifiers}. Unknown identifiers, plants
   * over the daily limit and plants already evaluated past {@code date} are reported in the
   * result; the rest of the batch proceeds.
   */
  public WateringResult waterPlants(LocalDate date, List<String> identifiers) {
    LocalDate day = resolveDate(date);
    List<String> requested = identifiers == null ? List.of() : identifiers;
    return inTransaction(() -> doWaterPlants(day, requested));
  }

  public WateringResult waterSinglePlant(LocalDate date, String identifier) {
    LocalDate day = resolveDate(date);
    return inTransaction(() -> {
      if (findPlant(identifier).isEmpty()) {
        throw new UnknownPlantException(identifier);
      }
      return doWaterPlants(day, List.of(identifier));
    });
  }

  public WateringStats getWateringStats(LocalDate date) {
    LocalDate day = resolveDate(date);
    return inTransaction(() -> {
      progressionService.tick(day.minusDays(1));
      int limit = admissionService.currentLimit();
      long wateredToday = wateringLedger.countDistinctPlantsWateredOn(day);
      List<PlantStatus> needingWater = plantRepository.findAll().stream()
          .map(PlantStatus::of)
          .filter(this::needsWater)
          .sorted(NEEDING_WATER_ORDER)
          .toList();
      return new WateringStats(day, limit, wateredToday, (int) Math.max(0, limit - wateredToday),
          wateringLedger.plantNamesWateredOn(day), needingWater);
    });
  }

  public int updateDailyLimit(int newLimit) {
    return inTransaction(() -> admissionService.updateDailyLimit(newLimit));
  }

  public List<WateringHistoryEntry> getWateringHistory(Long plantId, Integer limit) {
    return inTransaction(() -> wateringLedger.history(plantId, limit));
  }

  /**
   * Applies decay to every plant for the day before today.
   */
  public int closePreviousDay() {
    LocalDate yesterday = LocalDate.now(clock).minusDays(1);
    return inTransaction(() -> progressionService.tick(yesterday));
  }

  private WateringResult doWaterPlants(LocalDate day, List<String> identifiers) {
    Map<Long, Plant> requested = new LinkedHashMap<>();
    List<String> unknown = new ArrayList<>();
    List<String> alreadyEvaluated = new ArrayList<>();
    for (String identifier : new LinkedHashSet<>(identifiers)) {
      Optional<Plant> plant = findPlant(identifier);
      if (plant.isEmpty()) {
        log.warn("Unknown plant '{}' in watering request for {}", identifier, day);
        unknown.add(identifier);
      } else if (isEvaluatedAfter(plant.get(), day)) {
        log.warn("Plant '{}' is already evaluated through {}, watering for {} not recorded",
            plant.get().getName(), plant.get().getLastEvaluatedDate(), day);
        if (!alreadyEvaluated.contains(plant.get().getName())) {
          alreadyEvaluated.add(plant.get().getName());
        }
      } else {
        requested.putIfAbsent(plant.get().getId(), plant.get());
      }
    }

    AdmissionDecision decision = admissionService.tryAdmit(day, requested.keySet());
    Set<Long> newlyWatered = new LinkedHashSet<>();
    List<String> alreadyWatered = new ArrayList<>();
    for (Long plantId : decision.admitted()) {
      WateringRecord record = wateringLedger.recordWatering(plantId, day);
      if (record.accepted()) {
        newlyWatered.add(plantId);
      } else {
        alreadyWatered.add(requested.get(plantId).getName());
      }
    }
    List<String> rejected = decision.rejected().stream()
        .map(plantId -> requested.get(plantId).getName())
        .toList();

    List<PlantStatus> states = progressionService.applyDailyWatering(day, decision.admitted());
    List<PlantStatus> watered = states.stream()
        .filter(status -> newlyWatered.contains(status.id()))
        .toList();

    int limit = admissionService.currentLimit();
    long wateredToday = wateringLedger.countDistinctPlantsWateredOn(day);
    log.info("Watering on {}: {} watered, {} already watered, {} over limit, {} unknown, {} already evaluated",
        day, watered.size(), alreadyWatered.size(), rejected.size(), unknown.size(), alreadyEvaluated.size());
    return new WateringResult(day, watered, alreadyWatered, rejected, unknown, alreadyEvaluated, limit,
        wateredToday, decision.remainingCapacity());
  }

  private Optional<Plant> findPlant(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      return Optional.empty();
    }
    String value = identifier.trim();
    Optional<Plant> byName = plantRepository.findByName(value);
    if (byName.isPresent()) {
      return byName;
    }
    try {
      return plantRepository.findById(Long.parseLong(value));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private boolean isEvaluatedAfter(Plant plant, LocalDate day) {
    LocalDate last = plant.getLastEvaluatedDate();
    return last != null && last.isAfter(day);
  }

  private boolean needsWater(PlantStatus status) {
    return status.health() != PlantHealth.HEALTHY || status.daysWithoutWater() >= NEEDS_WATER_DAYS;
  }

  private LocalDate resolveDate(LocalDate date) {
    LocalDate today = LocalDate.now(clock);
    if (date == null) {
      return today;
    }
    if (date.isAfter(today)) {
      throw new IllegalArgumentException("Watering date " + date + " is in the future");
    }
    return date;
  }

  private <T> T inTransaction(Supplier<T> work) {
    synchronized (wateringLock) {
      return transactionTemplate.execute(status -> work.get());
    }
  }
}
