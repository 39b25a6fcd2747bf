package com.example.lifegarden.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "areals")
@Getter
@Setter
@NoArgsConstructor
public class Areal {
  @Id
  private String id;

  @Column(nullable = false)
  private String name;

  private String horizontalPos;
  private String verticalPos;
  private String size;

  private Instant createdAt = Instant.now();

  private Instant updatedAt = Instant.now();

  @OneToMany(mappedBy = "areal", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("name ASC")
  private List<Plant> plants = new ArrayList<>();
}
