package com.example.lifegarden.api;

import com.example.lifegarden.api.dto.GardenDtos;
import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.service.GardenService;
import com.example.lifegarden.util.ArealView;
import com.example.lifegarden.util.GardenStats;
import com.example.lifegarden.util.PlantStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/garden")
@RequiredArgsConstructor
public class GardenController {
  private final GardenService gardenService;

  @GetMapping
  public List<ArealView> garden() {
    return gardenService.getGarden();
  }

  @GetMapping("/stats")
  public GardenStats stats() {
    return gardenService.getGardenStats();
  }

  @GetMapping("/plants")
  public List<PlantStatus> plantsByHealth(@RequestParam("health") String health) {
    return gardenService.getPlantsByHealth(PlantHealth.fromTitle(health));
  }

  @PostMapping("/areals")
  public ResponseEntity<ArealView> createAreal(@Valid @RequestBody GardenDtos.CreateArealRequest body) {
    ArealView areal = gardenService.createAreal(body.id(), body.name(), body.horizontalPos(),
        body.verticalPos(), body.size());
    return ResponseEntity.status(HttpStatus.CREATED).body(areal);
  }

  @DeleteMapping("/areals/{id}")
  public ResponseEntity<Void> deleteAreal(@PathVariable("id") String id) {
    gardenService.deleteAreal(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/areals/{id}/plants")
  public ResponseEntity<PlantStatus> addPlant(@PathVariable("id") String arealId,
                                              @Valid @RequestBody GardenDtos.AddPlantRequest body) {
    PlantStatus plant = gardenService.addPlant(arealId, body.name(), body.health(), body.imagePath(),
        body.position());
    return ResponseEntity.status(HttpStatus.CREATED).body(plant);
  }

  @DeleteMapping("/plants/{id}")
  public ResponseEntity<Void> deletePlant(@PathVariable("id") Long id) {
    gardenService.deletePlant(id);
    return ResponseEntity.noContent().build();
  }
}
