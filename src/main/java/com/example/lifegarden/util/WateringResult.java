package com.example.lifegarden.util;

import java.time.LocalDate;
import java.util.List;

/**
 * @param alreadyEvaluated plants whose state already reflects a later date; a watering on
 *                         {@code date} can no longer be applied to them and is not recorded
 */
public record WateringResult(LocalDate date,
                             List<PlantStatus> watered,
                             List<String> alreadyWatered,
                             List<String> rejectedDueToCapacity,
                             List<String> unknown,
                             List<String> alreadyEvaluated,
                             int dailyLimit,
                             long wateredToday,
                             int remainingCapacity) {
}
