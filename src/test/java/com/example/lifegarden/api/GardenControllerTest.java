package com.example.lifegarden.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.lifegarden.domain.PlantHealth;
import com.example.lifegarden.domain.PlantSize;
import com.example.lifegarden.exception.UnknownArealException;
import com.example.lifegarden.service.GardenService;
import com.example.lifegarden.util.ArealView;
import com.example.lifegarden.util.GardenStats;
import com.example.lifegarden.util.PlantStatus;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = GardenController.class)
class GardenControllerTest {

  @Autowired
  MockMvc mvc;

  @MockBean
  GardenService gardenService;

  private PlantStatus swimming() {
    return new PlantStatus(4L, "Swimming", "sport", PlantHealth.DEAD, PlantSize.SMALL, 1, 0, 9, 2, null);
  }

  @Test
  void garden_lists_areals_with_plants() throws Exception {
    when(gardenService.getGarden())
        .thenReturn(List.of(new ArealView("sport", "Sport", "right", "top", "medium", List.of(swimming()))));

    mvc.perform(get("/api/garden"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("sport"))
        .andExpect(jsonPath("$[0].plants[0].size").value("small"));
  }

  @Test
  void stats_counts_plants_by_health() throws Exception {
    when(gardenService.getGardenStats()).thenReturn(new GardenStats(2, 5, 3, 1, 1));

    mvc.perform(get("/api/garden/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalPlants").value(5))
        .andExpect(jsonPath("$.deadPlants").value(1));
  }

  @Test
  void plants_by_health_accepts_lowercase_title() throws Exception {
    when(gardenService.getPlantsByHealth(PlantHealth.DEAD)).thenReturn(List.of(swimming()));

    mvc.perform(get("/api/garden/plants").param("health", "dead"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Swimming"));
  }

  @Test
  void plants_by_unknown_health_is_bad_request() throws Exception {
    mvc.perform(get("/api/garden/plants").param("health", "wilted"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void add_plant_to_missing_areal_is_not_found() throws Exception {
    when(gardenService.addPlant("work", "Deep focus", null, null, null))
        .thenThrow(new UnknownArealException("work"));

    mvc.perform(post("/api/garden/areals/work/plants")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"Deep focus\"}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void add_plant_reads_and_writes_lowercase_health_and_size() throws Exception {
    when(gardenService.addPlant("sport", "Swimming", PlantHealth.DEAD, null, null)).thenReturn(swimming());

    mvc.perform(post("/api/garden/areals/sport/plants")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"Swimming\",\"health\":\"dead\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.health").value("dead"))
        .andExpect(jsonPath("$.size").value("small"));
  }

  @Test
  void create_areal_returns_created() throws Exception {
    when(gardenService.createAreal("work", "Work", "center", "bottom", "big"))
        .thenReturn(new ArealView("work", "Work", "center", "bottom", "big", List.of()));

    mvc.perform(post("/api/garden/areals")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"id\":\"work\",\"name\":\"Work\",\"horizontalPos\":\"center\",\"verticalPos\":\"bottom\",\"size\":\"big\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("Work"));
  }

  @Test
  void delete_areal_returns_no_content() throws Exception {
    mvc.perform(delete("/api/garden/areals/work"))
        .andExpect(status().isNoContent());

    verify(gardenService).deleteAreal("work");
  }
}
