package com.example.lifegarden.service;

import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.WateringEvent;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.repository.WateringEventRepository;
import com.example.lifegarden.util.WateringHistoryEntry;
import com.example.lifegarden.util.WateringRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class WateringLedger {
  static final int DEFAULT_HISTORY_LIMIT = 100;

  private final WateringEventRepository wateringEventRepository;
  private final PlantRepository plantRepository;

  /**
   * Inserts the (plant, date) event unless one already exists. A repeated watering on the
   * same day is a no-op and never an error.
   */
  @Transactional
  public WateringRecord recordWatering(Long plantId, LocalDate date) {
    if (wateringEventRepository.existsByPlantIdAndWateringDate(plantId, date)) {
      return WateringRecord.duplicate();
    }
    Plant plant = plantRepository.getReferenceById(plantId);
    WateringEvent event = new WateringEvent();
    event.setPlant(plant);
    event.setWateringDate(date);
    wateringEventRepository.save(event);
    return WateringRecord.recorded();
  }

  @Transactional(readOnly = true)
  public long countDistinctPlantsWateredOn(LocalDate date) {
    return wateringEventRepository.countDistinctPlantsWateredOn(date);
  }

  @Transactional(readOnly = true)
  public boolean wasWateredOn(Long plantId, LocalDate date) {
    return wateringEventRepository.existsByPlantIdAndWateringDate(plantId, date);
  }

  @Transactional(readOnly = true)
  public List<String> plantNamesWateredOn(LocalDate date) {
    return wateringEventRepository.findByWateringDateOrderByIdAsc(date).stream()
        .map(event -> event.getPlant().getName())
        .toList();
  }

  @Transactional(readOnly = true)
  public List<WateringHistoryEntry> history(Long plantId, Integer limit) {
    Pageable page = PageRequest.of(0, limit == null || limit <= 0 ? DEFAULT_HISTORY_LIMIT : limit);
    List<WateringEvent> events = plantId == null
        ? wateringEventRepository.findAllByOrderByWateringDateDescIdDesc(page)
        : wateringEventRepository.findByPlantIdOrderByWateringDateDescIdDesc(plantId, page);
    return events.stream()
        .map(event -> new WateringHistoryEntry(event.getPlant().getId(), event.getPlant().getName(),
            event.getWateringDate()))
        .toList();
  }
}
