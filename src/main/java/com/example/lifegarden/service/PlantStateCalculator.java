package com.example.lifegarden.service;

import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.domain.PlantSize;
import com.example.lifegarden.util.PlantState;
import org.springframework.stereotype.Component;

/**
 * Turns one day of watering (or neglect) into the next plant state.
 * <p>
 * The calculation has no side effects and depends on nothing but its arguments.
 */
@Component
public class PlantStateCalculator {
  static final int STREAK_BREAK_DAYS = 2;

  static final int DEAD_RECOVERY_STREAK = 5;
  static final int OKAY_RECOVERY_STREAK = 7;
  static final int HEALTHY_KEEP_STREAK = 2;

  static final int HEALTHY_TO_DEAD_DAYS = 8;
  static final int HEALTHY_TO_OKAY_DAYS = 5;
  static final int OKAY_TO_DEAD_DAYS = 3;

  static final int SHRINK_TO_MEDIUM_DAYS = 4;
  static final int SHRINK_TO_SMALL_DAYS = 6;

  static final int MIN_GROWTH_STAGE = 1;
  static final int MAX_GROWTH_STAGE = 5;
  static final int NEGLECTED_GROWTH_CAP = 2;

  public PlantState next(PlantState current, boolean wateredToday) {
    return next(current, wateredToday, 1);
  }

  /**
   * Days skipped before today are replayed one at a time as dry days, so a plant caught up
   * lazily ends in the same state as one evaluated every day.
   *
   * @param elapsedDays days since the previous evaluation, including today; days before
   *                    today count as days without water
   */
  public PlantState next(PlantState current, boolean wateredToday, int elapsedDays) {
    if (current == null) {
      throw new IllegalArgumentException("Current plant state is required");
    }
    if (elapsedDays < 1) {
      throw new IllegalArgumentException("Elapsed days must be positive: " + elapsedDays);
    }
    PlantState state = current;
    for (int day = 1; day < elapsedDays; day++) {
      state = step(state, false);
    }
    return step(state, wateredToday);
  }

  /**
   * Size of a plant that has not been evaluated yet.
   */
  public PlantState initial(PlantHealth health) {
    PlantHealth start = health == null ? PlantHealth.HEALTHY : health;
    return new PlantState(start, sizeFor(start, MIN_GROWTH_STAGE, 0), MIN_GROWTH_STAGE, 0, 0, 0);
  }

  private PlantState step(PlantState current, boolean wateredToday) {
    int streak;
    int daysWithoutWater;
    int totalWaterCount = current.totalWaterCount();
    int growthStage;
    PlantHealth health;

    if (wateredToday) {
      totalWaterCount++;
      streak = current.daysWithoutWater() >= STREAK_BREAK_DAYS ? 1 : current.waterStreak() + 1;
      daysWithoutWater = 0;
      health = healthAfterWatering(current.health(), streak);
      growthStage = growthAfterWatering(current.growthStage(), current.waterStreak(), streak);
    } else {
      daysWithoutWater = current.daysWithoutWater() + 1;
      streak = daysWithoutWater >= STREAK_BREAK_DAYS ? 0 : current.waterStreak();
      health = healthAfterNeglect(current.health(), daysWithoutWater);
      growthStage = daysWithoutWater >= SHRINK_TO_SMALL_DAYS
          ? Math.min(current.growthStage(), NEGLECTED_GROWTH_CAP)
          : current.growthStage();
    }

    PlantSize size = sizeFor(health, growthStage, daysWithoutWater);
    return new PlantState(health, size, growthStage, streak, daysWithoutWater, totalWaterCount);
  }

  PlantHealth healthAfterWatering(PlantHealth current, int streak) {
    return switch (current) {
      case DEAD -> streak >= DEAD_RECOVERY_STREAK ? PlantHealth.OKAY : PlantHealth.DEAD;
      case OKAY -> streak >= OKAY_RECOVERY_STREAK ? PlantHealth.HEALTHY : PlantHealth.OKAY;
      case HEALTHY -> PlantHealth.HEALTHY;
    };
  }

  // 8-day rule before the 5-day rule
  PlantHealth healthAfterNeglect(PlantHealth current, int daysWithoutWater) {
    return switch (current) {
      case HEALTHY -> {
        if (daysWithoutWater >= HEALTHY_TO_DEAD_DAYS) {
          yield PlantHealth.DEAD;
        }
        if (daysWithoutWater >= HEALTHY_TO_OKAY_DAYS) {
          yield PlantHealth.OKAY;
        }
        yield PlantHealth.HEALTHY;
      }
      case OKAY -> daysWithoutWater >= OKAY_TO_DEAD_DAYS ? PlantHealth.DEAD : PlantHealth.OKAY;
      case DEAD -> PlantHealth.DEAD;
    };
  }

  int growthAfterWatering(int currentStage, int previousStreak, int streak) {
    int grown = streak > previousStreak ? currentStage + 1 : currentStage;
    int fromStreak = MIN_GROWTH_STAGE + streak / 2;
    return clamp(Math.max(grown, fromStreak), MIN_GROWTH_STAGE, MAX_GROWTH_STAGE);
  }

  PlantSize sizeFor(PlantHealth health, int growthStage, int daysWithoutWater) {
    PlantSize size = switch (health) {
      case DEAD -> PlantSize.SMALL;
      case OKAY -> growthStage >= 4 ? PlantSize.MEDIUM : PlantSize.SMALL;
      case HEALTHY -> {
        if (growthStage >= 4) {
          yield PlantSize.BIG;
        }
        yield growthStage == 3 ? PlantSize.MEDIUM : PlantSize.SMALL;
      }
    };
    if (daysWithoutWater >= SHRINK_TO_SMALL_DAYS) {
      return PlantSize.SMALL;
    }
    if (daysWithoutWater >= SHRINK_TO_MEDIUM_DAYS) {
      return size.atMost(PlantSize.MEDIUM);
    }
    return size;
  }

  private int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }
}
