package com.example.lifegarden.repository;

import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.domain.PlantHealth;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PlantRepository extends JpaRepository<Plant, Long> {
  Optional<Plant> findByName(String name);

  boolean existsByName(String name);

  List<Plant> findAllByOrderByIdAsc();

  List<Plant> findByVitalsHealthOrderByNameAsc(PlantHealth health);

  long countByVitalsHealth(PlantHealth health);
}
