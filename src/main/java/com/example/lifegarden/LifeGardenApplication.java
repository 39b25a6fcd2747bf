package com.example.lifegarden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LifeGardenApplication {
  public static void main(String[] args) {
    SpringApplication.run(LifeGardenApplication.class, args);
  }
}
