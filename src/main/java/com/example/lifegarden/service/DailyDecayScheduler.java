package com.example.lifegarden.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.garden", name = "tick-enabled", havingValue = "true", matchIfMissing = true)
public class DailyDecayScheduler {
  private final WateringService wateringService;

  @Scheduled(cron = "${app.garden.tick-cron:0 5 0 * * *}", zone = "${app.garden.zone:}")
  public void dailyTick() {
    int evaluated = wateringService.closePreviousDay();
    log.info("Daily decay tick finished, {} plant(s) evaluated", evaluated);
  }
}
