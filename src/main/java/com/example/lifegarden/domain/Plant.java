package com.example.lifegarden.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "plants")
@Getter
@Setter
@NoArgsConstructor
public class Plant {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(optional = false, fetch = FetchType.LAZY)
  @JoinColumn(name = "areal_id")
  private Areal areal;

  @Column(nullable = false, unique = true)
  private String name;

  private String imagePath;

  private String position;

  @Embedded
  private PlantVitals vitals = new PlantVitals();

  /**
   * Vitals as they were before the evaluation stamped in {@link #lastEvaluatedDate}.
   */
  @Embedded
  @AttributeOverrides({
      @AttributeOverride(name = "health", column = @Column(name = "baseline_health", nullable = false)),
      @AttributeOverride(name = "size", column = @Column(name = "baseline_size", nullable = false)),
      @AttributeOverride(name = "growthStage", column = @Column(name = "baseline_growth_stage", nullable = false)),
      @AttributeOverride(name = "waterStreak", column = @Column(name = "baseline_water_streak", nullable = false)),
      @AttributeOverride(name = "daysWithoutWater",
          column = @Column(name = "baseline_days_without_water", nullable = false)),
      @AttributeOverride(name = "totalWaterCount",
          column = @Column(name = "baseline_total_water_count", nullable = false))
  })
  private PlantVitals baseline = new PlantVitals();

  private LocalDate lastWatered;

  private LocalDate lastEvaluatedDate;

  @Version
  private Long version;

  @OneToMany(mappedBy = "plant", cascade = CascadeType.ALL, orphanRemoval = true)
  private List<WateringEvent> wateringEvents = new ArrayList<>();

  private Instant createdAt = Instant.now();

  private Instant updatedAt = Instant.now();
}
