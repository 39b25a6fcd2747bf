package com.example.lifegarden.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "watering_history",
    uniqueConstraints = @UniqueConstraint(name = "uk_watering_plant_date", columnNames = {"plant_id", "watering_date"}),
    indexes = @Index(name = "idx_watering_history_date", columnList = "watering_date"))
@Getter
@Setter
@NoArgsConstructor
public class WateringEvent {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(optional = false, fetch = FetchType.LAZY)
  @JoinColumn(name = "plant_id")
  private Plant plant;

  @Column(name = "watering_date", nullable = false)
  private LocalDate wateringDate;

  private Instant createdAt = Instant.now();
}
