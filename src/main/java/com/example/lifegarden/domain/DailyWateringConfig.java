package com.example.lifegarden.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "daily_watering_config")
@Getter
@Setter
@NoArgsConstructor
public class DailyWateringConfig {
  public static final int SINGLETON_ID = 1;
  public static final int MIN_PLANTS_PER_DAY = 1;
  public static final int MAX_PLANTS_PER_DAY = 50;

  @Id
  private Integer id = SINGLETON_ID;

  @Column(nullable = false)
  private int maxPlantsPerDay;

  private Instant updatedAt = Instant.now();
}
