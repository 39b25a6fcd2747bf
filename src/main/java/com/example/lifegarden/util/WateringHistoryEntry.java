package com.example.lifegarden.util;

import java.time.LocalDate;

public record WateringHistoryEntry(Long plantId, String plantName, LocalDate wateringDate) {
}
