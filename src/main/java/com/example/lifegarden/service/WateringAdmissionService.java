package com.example.lifegarden.service;

import com.example.lifegarden.config.GardenProperties;
import com.example.lifegarden.domain.DailyWateringConfig;
import com.example.lifegarden.exception.InvalidConfigException;
import com.example.lifegarden.repository.DailyWateringConfigRepository;
import com.example.lifegarden.util.AdmissionDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Caps how many distinct plants may be watered on one day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WateringAdmissionService {
  private final DailyWateringConfigRepository configRepository;
  private final WateringLedger wateringLedger;
  private final GardenProperties gardenProperties;

  /**
   * Plants already watered on {@code date} are always admitted and take no capacity. The
   * others are admitted first-requested, first-admitted until the day's capacity is used up.
   */
  @Transactional
  public AdmissionDecision tryAdmit(LocalDate date, Collection<Long> requestedPlantIds) {
    int limit = currentLimit();
    long alreadyWatered = wateringLedger.countDistinctPlantsWateredOn(date);
    int remaining = (int) Math.max(0, limit - alreadyWatered);

    Set<Long> admitted = new LinkedHashSet<>();
    Set<Long> rejected = new LinkedHashSet<>();
    for (Long plantId : new LinkedHashSet<>(requestedPlantIds)) {
      if (wateringLedger.wasWateredOn(plantId, date)) {
        admitted.add(plantId);
      } else if (remaining > 0) {
        admitted.add(plantId);
        remaining--;
      } else {
        rejected.add(plantId);
      }
    }
    if (!rejected.isEmpty()) {
      log.info("Daily watering limit {} reached on {}: {} plant(s) rejected", limit, date, rejected.size());
    }
    return new AdmissionDecision(Collections.unmodifiableSet(admitted),
        Collections.unmodifiableSet(rejected), remaining);
  }

  @Transactional
  public int currentLimit() {
    return getOrCreateConfig().getMaxPlantsPerDay();
  }

  @Transactional
  public int updateDailyLimit(int newLimit) {
    if (newLimit < DailyWateringConfig.MIN_PLANTS_PER_DAY || newLimit > DailyWateringConfig.MAX_PLANTS_PER_DAY) {
      log.warn("Rejected daily watering limit {}", newLimit);
      throw new InvalidConfigException("Daily watering limit must be between "
          + DailyWateringConfig.MIN_PLANTS_PER_DAY + " and " + DailyWateringConfig.MAX_PLANTS_PER_DAY
          + ", got " + newLimit);
    }
    DailyWateringConfig config = getOrCreateConfig();
    int previous = config.getMaxPlantsPerDay();
    config.setMaxPlantsPerDay(newLimit);
    config.setUpdatedAt(Instant.now());
    configRepository.save(config);
    log.info("Daily watering limit changed from {} to {}", previous, newLimit);
    return newLimit;
  }

  private DailyWateringConfig getOrCreateConfig() {
    return configRepository.findById(DailyWateringConfig.SINGLETON_ID)
        .orElseGet(() -> {
          DailyWateringConfig config = new DailyWateringConfig();
          config.setMaxPlantsPerDay(gardenProperties.defaultDailyLimitOrDefault());
          return configRepository.save(config);
        });
  }
}
