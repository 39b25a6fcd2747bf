package com.example.lifegarden.service;

import com.example.lifegarden.domain.Areal;
import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.domain.PlantVitals;
import com.example.lifegarden.exception.UnknownArealException;
import com.example.lifegarden.exception.UnknownPlantException;
import com.example.lifegarden.repository.ArealRepository;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.util.ArealView;
import com.example.lifegarden.util.GardenStats;
import com.example.lifegarden.util.PlantState;
import com.example.lifegarden.util.PlantStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GardenService {
  private final ArealRepository arealRepository;
  private final PlantRepository plantRepository;
  private final PlantStateCalculator calculator;
  private final Clock clock;

  @Transactional
  public ArealView createAreal(String id, String name, String horizontalPos, String verticalPos, String size) {
    requireText(id, "Areal id");
    requireText(name, "Areal name");
    Areal areal = arealRepository.findById(id.trim()).orElseGet(() -> {
      Areal fresh = new Areal();
      fresh.setId(id.trim());
      return fresh;
    });
    areal.setName(name.trim());
    areal.setHorizontalPos(horizontalPos);
    areal.setVerticalPos(verticalPos);
    areal.setSize(size);
    areal.setUpdatedAt(Instant.now());
    return toView(arealRepository.save(areal));
  }

  /**
   * Adds a plant that has never been watered. It counts as evaluated through yesterday, so
   * the first day it is judged on is the day it was planted.
   */
  @Transactional
  public PlantStatus addPlant(String arealId,
                              String name,
                              PlantHealth initialHealth,
                              String imagePath,
                              String position) {
    requireText(name, "Plant name");
    Areal areal = arealRepository.findById(arealId).orElseThrow(() -> new UnknownArealException(arealId));
    String plantName = name.trim();
    if (plantRepository.existsByName(plantName)) {
      throw new IllegalArgumentException("Plant '" + plantName + "' already exists");
    }
    PlantState initial = calculator.initial(initialHealth);
    Plant plant = new Plant();
    plant.setAreal(areal);
    plant.setName(plantName);
    plant.setImagePath(imagePath);
    plant.setPosition(position);
    plant.setVitals(PlantVitals.of(initial));
    plant.setBaseline(PlantVitals.of(initial));
    plant.setLastEvaluatedDate(LocalDate.now(clock).minusDays(1));
    areal.getPlants().add(plant);
    Plant saved = plantRepository.save(plant);
    log.info("Plant '{}' planted in areal {}", saved.getName(), areal.getId());
    return PlantStatus.of(saved);
  }

  @Transactional
  public void deleteAreal(String arealId) {
    Areal areal = arealRepository.findById(arealId).orElseThrow(() -> new UnknownArealException(arealId));
    arealRepository.delete(areal);
    log.info("Areal {} deleted with {} plant(s)", arealId, areal.getPlants().size());
  }

  @Transactional
  public void deletePlant(Long plantId) {
    Plant plant = plantRepository.findById(plantId)
        .orElseThrow(() -> new UnknownPlantException(String.valueOf(plantId)));
    plant.getAreal().getPlants().remove(plant);
    plantRepository.delete(plant);
  }

  @Transactional(readOnly = true)
  public List<ArealView> getGarden() {
    return arealRepository.findAllByOrderByNameAsc().stream()
        .map(this::toView)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<PlantStatus> getPlantsByHealth(PlantHealth health) {
    return plantRepository.findByVitalsHealthOrderByNameAsc(health).stream()
        .map(PlantStatus::of)
        .toList();
  }

  @Transactional(readOnly = true)
  public GardenStats getGardenStats() {
    return new GardenStats(arealRepository.count(),
        plantRepository.count(),
        plantRepository.countByVitalsHealth(PlantHealth.HEALTHY),
        plantRepository.countByVitalsHealth(PlantHealth.OKAY),
        plantRepository.countByVitalsHealth(PlantHealth.DEAD));
  }

  private ArealView toView(Areal areal) {
    return new ArealView(areal.getId(),
        areal.getName(),
        areal.getHorizontalPos(),
        areal.getVerticalPos(),
        areal.getSize(),
        areal.getPlants().stream().map(PlantStatus::of).toList());
  }

  private void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is empty");
    }
  }
}
