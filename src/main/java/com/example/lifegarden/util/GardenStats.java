package com.example.lifegarden.util;

public record GardenStats(long totalAreals,
                          long totalPlants,
                          long healthyPlants,
                          long okayPlants,
                          long deadPlants) {
}
