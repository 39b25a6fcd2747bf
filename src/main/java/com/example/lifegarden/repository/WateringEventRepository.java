package com.example.lifegarden.repository;

import com.example.lifegarden.domain.WateringEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface WateringEventRepository extends JpaRepository<WateringEvent, Long> {
  boolean existsByPlantIdAndWateringDate(Long plantId, LocalDate wateringDate);

  @Query("select count(distinct e.plant.id) from WateringEvent e where e.wateringDate = :date")
  long countDistinctPlantsWateredOn(@Param("date") LocalDate date);

  List<WateringEvent> findByWateringDateOrderByIdAsc(LocalDate wateringDate);

  List<WateringEvent> findByPlantIdOrderByWateringDateDescIdDesc(Long plantId, Pageable pageable);

  List<WateringEvent> findAllByOrderByWateringDateDescIdDesc(Pageable pageable);
}
