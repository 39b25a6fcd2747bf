package com.example.lifegarden.repository;

import com.example.lifegarden.domain.DailyWateringConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DailyWateringConfigRepository extends JpaRepository<DailyWateringConfig, Integer> {
}
