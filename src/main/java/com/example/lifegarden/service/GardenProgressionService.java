package com.example.lifegarden.service;

import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.PlantVitals;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.util.PlantState;
import com.example.lifegarden.util.PlantStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Moves every plant forward one calendar day at a time.
 * <p>
 * A plant is evaluated at most once per date. {@code lastEvaluatedDate} marks the date its
 * vitals reflect and {@code baseline} keeps the vitals from before that evaluation, so a
 * watering that arrives after the day was already evaluated as dry replaces the dry
 * evaluation instead of stacking on top of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GardenProgressionService {
  private final PlantRepository plantRepository;
  private final PlantStateCalculator calculator;

  /**
   * Evaluates {@code date} for every plant: watered for the given ids, dry for the rest.
   *
   * @return the state of every plant after the evaluation
   */
  @Transactional
  public List<PlantStatus> applyDailyWatering(LocalDate date, Collection<Long> wateredPlantIds) {
    List<PlantStatus> states = new ArrayList<>();
    int changed = 0;
    for (Plant plant : plantRepository.findAllByOrderByIdAsc()) {
      if (evaluate(plant, date, wateredPlantIds.contains(plant.getId()))) {
        changed++;
      }
      states.add(PlantStatus.of(plant));
    }
    log.debug("Evaluated {} on {} plant(s), {} changed", date, states.size(), changed);
    return states;
  }

  /**
   * Applies decay for {@code date} to every plant not yet evaluated on that date.
   *
   * @return number of plants that were evaluated
   */
  @Transactional
  public int tick(LocalDate date) {
    int evaluated = 0;
    for (Plant plant : plantRepository.findAllByOrderByIdAsc()) {
      LocalDate last = plant.getLastEvaluatedDate();
      if (last != null && !last.isBefore(date)) {
        continue;
      }
      if (evaluate(plant, date, false)) {
        evaluated++;
      }
    }
    if (evaluated > 0) {
      log.info("Decay applied for {} to {} plant(s)", date, evaluated);
    }
    return evaluated;
  }

  boolean evaluate(Plant plant, LocalDate date, boolean watered) {
    LocalDate last = plant.getLastEvaluatedDate();
    if (last != null && date.isBefore(last)) {
      log.warn("Skipping evaluation of plant {} for {}: already evaluated through {}",
          plant.getName(), date, last);
      return false;
    }

    if (date.equals(last)) {
      if (!watered || date.equals(plant.getLastWatered())) {
        return false;
      }
      PlantState redone = calculator.next(plant.getBaseline().toState(), true);
      store(plant, redone, date, true);
      return true;
    }

    PlantState current = plant.getVitals().toState();
    LocalDate dayBefore = date.minusDays(1);
    if (last != null && last.isBefore(dayBefore)) {
      int skipped = (int) ChronoUnit.DAYS.between(last, dayBefore);
      current = calculator.next(current, false, skipped);
    }
    plant.setBaseline(PlantVitals.of(current));
    store(plant, calculator.next(current, watered), date, watered);
    return true;
  }

  private void store(Plant plant, PlantState state, LocalDate date, boolean watered) {
    plant.getVitals().apply(state);
    if (watered) {
      plant.setLastWatered(date);
    }
    plant.setLastEvaluatedDate(date);
    plant.setUpdatedAt(Instant.now());
    plantRepository.save(plant);
  }
}
