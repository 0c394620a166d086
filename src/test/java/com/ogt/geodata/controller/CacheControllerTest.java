package com.ogt.geodata.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.geodata.cache.CacheConfig;
import com.ogt.geodata.cache.GeometrySampler;
import com.ogt.geodata.cache.ResultCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheControllerTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();
    private ResultCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cache = new ResultCache(CacheConfig.of(root), Clock.systemUTC());
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheController(cache, new GeometrySampler(cache)))
                .setControllerAdvice(new GeodataExceptionHandler())
                .build();
    }

    private String storedRoute() {
        List<Object> coordinates = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            coordinates.add(List.of(i * 0.01, i * 0.02));
        }
        Map<String, Object> route = Map.of(
                "distance", 42000,
                "geometry", Map.of("type", "LineString", "coordinates", coordinates));
        return cache.put(route, "calculate_route", Map.of("profile", "car")).getCacheId();
    }

    @Test
    void respondCachesRoutesAndPassesSmallResultsThrough() throws Exception {
        String body = mapper.writeValueAsString(Map.of("result", Map.of("distance", 10), "params", Map.of()));

        mockMvc.perform(post("/api/geodata/cache").param("tool_name", "calculate_route")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cached").value(true))
                .andExpect(jsonPath("$.cache_id").value(startsWith("calculate_route_")));

        mockMvc.perform(post("/api/geodata/cache").param("tool_name", "geocode")
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.distance").value(10));
    }

    @Test
    void toolNameIsRequired() throws Exception {
        mockMvc.perform(post("/api/geodata/cache").contentType(MediaType.APPLICATION_JSON).content("{\"result\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("MISSING_PARAMETER"));
    }

    @Test
    void metadataAndListing() throws Exception {
        String id = storedRoute();

        mockMvc.perform(get("/api/geodata/cache/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tool_name").value("calculate_route"))
                .andExpect(jsonPath("$.summary.geometry_points_count").value(500));

        mockMvc.perform(get("/api/geodata/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void unknownEntryIsNotFound() throws Exception {
        mockMvc.perform(get("/api/geodata/cache/{id}", "calculate_route_1_00000000"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
        mockMvc.perform(get("/api/geodata/cache/{id}/geometry", "calculate_route_1_00000000"))
                .andExpect(status().isNotFound());
    }

    @Test
    void geometryPreviewIsBounded() throws Exception {
        String id = storedRoute();

        mockMvc.perform(get("/api/geodata/cache/{id}/geometry", id).param("max_points", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coordinates", hasSize(20)))
                .andExpect(jsonPath("$.sampled").value(true))
                .andExpect(jsonPath("$.total_points").value(500));
    }

    @Test
    void geometryPreviewBelowTwoPointsIsBadRequest() throws Exception {
        String id = storedRoute();

        mockMvc.perform(get("/api/geodata/cache/{id}/geometry", id).param("max_points", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_PARAMETER"));
    }

    @Test
    void respondWithUnsafeToolNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/geodata/cache").param("tool_name", "../escaped")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of("result", Map.of("distance", 1)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_PARAMETER"));
    }

    @Test
    void exportWritesTheFile(@TempDir Path target) throws Exception {
        String id = storedRoute();
        Path destination = target.resolve("route.json");

        mockMvc.perform(post("/api/geodata/cache/{id}/export", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of("output_path", destination.toString()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        assertThat(Files.exists(destination)).isTrue();
    }

    @Test
    void clearReportsDeletedFiles() throws Exception {
        storedRoute();

        mockMvc.perform(delete("/api/geodata/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_files").value(2));
    }
}
