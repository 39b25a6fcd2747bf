package com.example.lifegarden.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GardenProperties.class)
public class AppConfig {
  /**
   * Source of "today" for every watering and decay evaluation.
   */
  @Bean
  public Clock gardenClock(GardenProperties properties) {
    return Clock.system(properties.zoneOrDefault());
  }
}
