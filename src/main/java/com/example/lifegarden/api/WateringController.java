package com.example.lifegarden.api;

import com.example.lifegarden.api.dto.GardenDtos;
import com.example.lifegarden.service.WateringService;
import com.example.lifegarden.util.WateringHistoryEntry;
import com.example.lifegarden.util.WateringResult;
import com.example.lifegarden.util.WateringStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/watering")
@RequiredArgsConstructor
public class WateringController {
  private final WateringService wateringService;

  @PostMapping
  public WateringResult water(@Valid @RequestBody GardenDtos.WaterRequest body) {
    return wateringService.waterPlants(body.date(), body.plants());
  }

  @PostMapping("/plants/{identifier}")
  public WateringResult waterOne(@PathVariable("identifier") String identifier,
                                 @RequestParam(name = "date", required = false)
                                 @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return wateringService.waterSinglePlant(date, identifier);
  }

  @GetMapping("/stats")
  public WateringStats stats(@RequestParam(name = "date", required = false)
                             @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return wateringService.getWateringStats(date);
  }

  @GetMapping("/history")
  public List<WateringHistoryEntry> history(@RequestParam(name = "plantId", required = false) Long plantId,
                                            @RequestParam(name = "limit", required = false) Integer limit) {
    return wateringService.getWateringHistory(plantId, limit);
  }

  @PutMapping("/limit")
  public GardenDtos.DailyLimitResponse updateLimit(@Valid @RequestBody GardenDtos.DailyLimitRequest body) {
    return new GardenDtos.DailyLimitResponse(wateringService.updateDailyLimit(body.maxPlantsPerDay()));
  }
}
