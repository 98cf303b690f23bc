package dev.zzpscanner.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.zzpscanner.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@AutoConfigureMockMvc
class BusinessApiIT extends BaseIntegrationTest {

  @Autowired private MockMvc mvc;

  @Autowired private ObjectMapper objectMapper;

  @Test
  void businessCrudThroughTheApi() throws Exception {
    String created =
        mvc.perform(
                post("/api/v1/businesses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Fietsmaker Vos", "city": "Haarlem", "country": "Netherlands",
                         "source": "api_it", "source_id": "vos-1", "confidence_score": 0.4}
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.is_zzp").value(true))
            .andExpect(jsonPath("$.is_processed").value(false))
            .andReturn()
            .getResponse()
            .getContentAsString();
    long id = objectMapper.readTree(created).path("id").asLong();

    mvc.perform(
            put("/api/v1/businesses/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"industry\": \"Fietsen\", \"is_verified\": true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.industry").value("Fietsen"))
        .andExpect(jsonPath("$.is_verified").value(true))
        .andExpect(jsonPath("$.city").value("Haarlem"));

    mvc.perform(get("/api/v1/businesses").param("source", "api_it").param("city", "Haarlem"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].source_id").value("vos-1"));

    mvc.perform(get("/api/v1/businesses/search").param("q", "fietsmaker"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Fietsmaker Vos"));

    mvc.perform(delete("/api/v1/businesses/{id}", id)).andExpect(status().isNoContent());
    mvc.perform(get("/api/v1/businesses/{id}", id)).andExpect(status().isNotFound());
  }

  @Test
  void invalidConfidenceIsRejected() throws Exception {
    mvc.perform(
            post("/api/v1/businesses")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Te Zeker BV\", \"confidence_score\": 1.5}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("confidenceScore")));
  }

  @Test
  void csvExportHonoursFilters() throws Exception {
    mvc.perform(
            post("/api/v1/businesses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Kapsalon Export", "city": "Tilburg", "source": "csv_it"}
                    """))
        .andExpect(status().isCreated());

    mvc.perform(get("/api/v1/exports/businesses.csv").param("source", "csv_it"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", containsString("attachment")))
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(content().string(containsString("Kapsalon Export,,Tilburg")));
  }

  @Test
  void dashboardStatsAreServed() throws Exception {
    mvc.perform(get("/api/v1/dashboard/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_businesses").isNumber())
        .andExpect(jsonPath("$.jobs_by_status.pending").isNumber())
        .andExpect(jsonPath("$.jobs_by_status.cancelled").isNumber());

    mvc.perform(get("/api/v1/dashboard/top-cities").param("limit", "0"))
        .andExpect(status().isBadRequest());
  }
}
