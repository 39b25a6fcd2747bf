package com.example.lifegarden.util;

import java.time.LocalDate;
import java.util.List;

public record WateringStats(LocalDate date,
                            int maxPerDay,
                            long wateredToday,
                            int remaining,
                            List<String> wateredPlants,
                            List<PlantStatus> plantsNeedingWater) {
}
