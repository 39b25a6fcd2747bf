package com.example.lifegarden.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.lifegarden.domain.Areal;
import com.example.lifegarden.domain.Plant;
import com.example.lifegarden.repository.ArealRepository;
import com.example.lifegarden.repository.PlantRepository;
import com.example.lifegarden.util.WateringHistoryEntry;
import com.example.lifegarden.util.WateringRecord;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(WateringLedger.class)
class WateringLedgerTest {

  private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

  @Autowired
  WateringLedger ledger;

  @Autowired
  PlantRepository plantRepository;

  @Autowired
  ArealRepository arealRepository;

  private Plant running;
  private Plant reading;

  @BeforeEach
  void setUp() {
    Areal areal = new Areal();
    areal.setId("hobby");
    areal.setName("Hobby");
    arealRepository.save(areal);
    running = plant(areal, "Running");
    reading = plant(areal, "Reading");
  }

  private Plant plant(Areal areal, String name) {
    Plant plant = new Plant();
    plant.setAreal(areal);
    plant.setName(name);
    return plantRepository.save(plant);
  }

  @Test
  @DisplayName("First watering of the day is recorded, the second is reported as a duplicate")
  void recordsOncePerDay() {
    WateringRecord first = ledger.recordWatering(running.getId(), DAY);
    WateringRecord second = ledger.recordWatering(running.getId(), DAY);

    assertThat(first).isEqualTo(new WateringRecord(true, false));
    assertThat(second).isEqualTo(new WateringRecord(false, true));
    assertThat(ledger.countDistinctPlantsWateredOn(DAY)).isEqualTo(1);
  }

  @Test
  @DisplayName("Counts distinct plants per day only")
  void countsPerDay() {
    ledger.recordWatering(running.getId(), DAY);
    ledger.recordWatering(reading.getId(), DAY);
    ledger.recordWatering(running.getId(), DAY.minusDays(1));

    assertThat(ledger.countDistinctPlantsWateredOn(DAY)).isEqualTo(2);
    assertThat(ledger.countDistinctPlantsWateredOn(DAY.minusDays(1))).isEqualTo(1);
    assertThat(ledger.countDistinctPlantsWateredOn(DAY.plusDays(1))).isZero();
  }

  @Test
  @DisplayName("wasWateredOn reflects the ledger")
  void wasWateredOn() {
    ledger.recordWatering(running.getId(), DAY);

    assertThat(ledger.wasWateredOn(running.getId(), DAY)).isTrue();
    assertThat(ledger.wasWateredOn(reading.getId(), DAY)).isFalse();
    assertThat(ledger.wasWateredOn(running.getId(), DAY.minusDays(1))).isFalse();
  }

  @Test
  @DisplayName("History lists newest first and honours plant filter and limit")
  void historyNewestFirst() {
    ledger.recordWatering(running.getId(), DAY.minusDays(2));
    ledger.recordWatering(running.getId(), DAY.minusDays(1));
    ledger.recordWatering(reading.getId(), DAY);

    List<WateringHistoryEntry> all = ledger.history(null, null);
    List<WateringHistoryEntry> runningOnly = ledger.history(running.getId(), 1);

    assertThat(all).extracting(WateringHistoryEntry::wateringDate)
        .containsExactly(DAY, DAY.minusDays(1), DAY.minusDays(2));
    assertThat(runningOnly).containsExactly(new WateringHistoryEntry(running.getId(), "Running", DAY.minusDays(1)));
    assertThat(ledger.plantNamesWateredOn(DAY)).containsExactly("Reading");
  }
}
