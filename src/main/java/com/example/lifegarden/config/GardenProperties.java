package com.example.lifegarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.garden")
public record GardenProperties(
    Integer defaultDailyLimit,
    String zone,
    String tickCron,
    Boolean tickEnabled
) {
  public int defaultDailyLimitOrDefault() {
    return defaultDailyLimit != null ? defaultDailyLimit : 4;
  }

  public ZoneId zoneOrDefault() {
    if (zone == null || zone.isBlank()) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(zone.trim());
  }
}
