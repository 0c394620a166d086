package com.ogt.geodata.controller;

import com.ogt.geodata.cache.CacheEntry;
import com.ogt.geodata.cache.GeometrySampler;
import com.ogt.geodata.cache.ResultCache;
import com.ogt.geodata.config.OpenApiConfig;
import com.ogt.geodata.dto.CacheExportRequest;
import com.ogt.geodata.dto.CacheExportResultDTO;
import com.ogt.geodata.dto.CacheRespondRequest;
import com.ogt.geodata.dto.SampledGeometryDTO;
import com.ogt.geodata.exception.GeodataException;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = OpenApiConfig.TAG_CACHE)
@RequestMapping("/api/geodata/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ResultCache resultCache;
    private final GeometrySampler geometrySampler;

    /**
     * Cachea el resultado si es voluminoso y devuelve los metadatos; si no, lo devuelve tal cual.
     *
     * Ejemplo: POST /api/geodata/cache?tool_name=calculate_route
     */
    @PostMapping
    public ResponseEntity<Object> respond(
            @RequestParam("tool_name") String toolName,
            @RequestBody @Valid CacheRespondRequest request
    ) {
        return ResponseEntity.ok(resultCache.respond(request.getResult(), toolName, request.getParams()));
    }

    @GetMapping
    public ResponseEntity<List<CacheEntry>> list() {
        return ResponseEntity.ok(resultCache.list());
    }

    // Solo metadatos + resumen; el resultado completo se obtiene con /export
    @GetMapping("/{cacheId}")
    public ResponseEntity<CacheEntry> get(@PathVariable String cacheId) {
        CacheEntry entry = resultCache.get(cacheId);
        if (entry == null) {
            throw GeodataException.notFound(cacheId);
        }
        return ResponseEntity.ok(entry);
    }

    // GET /api/geodata/cache/{id}/geometry?max_points=50
    @GetMapping("/{cacheId}/geometry")
    public ResponseEntity<SampledGeometryDTO> sampleGeometry(
            @PathVariable String cacheId,
            @RequestParam(name = "max_points", defaultValue = "100") int maxPoints
    ) {
        SampledGeometryDTO sample = geometrySampler.sample(cacheId, maxPoints);
        if (sample == null) {
            throw GeodataException.notFound(cacheId);
        }
        return ResponseEntity.ok(sample);
    }

    @PostMapping("/{cacheId}/export")
    public ResponseEntity<CacheExportResultDTO> export(
            @PathVariable String cacheId,
            @RequestBody @Valid CacheExportRequest request
    ) {
        return ResponseEntity.ok(resultCache.export(cacheId, request.getOutputPath()));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        int deleted = resultCache.clear();
        return ResponseEntity.ok(Map.of("deleted_files", deleted));
    }
}
