package com.ogt.geodata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.cache.ResultSummarizer.asList;
import static com.ogt.geodata.cache.ResultSummarizer.asMap;

/**
 * Colección de features (WFS): conteo, filtros y una feature de ejemplo sin coordenadas.
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureCollectionSummarizer implements ResultSummarizer {

    private final ObjectMapper mapper;

    @Override
    public OperationKind kind() {
        return OperationKind.FEATURE_COLLECTION;
    }

    @Override
    public Map<String, Object> summarize(Object result, Map<String, Object> params) {
        Map<String, Object> data = asMap(result);
        List<Object> features = asList(data.get("features"));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "FeatureCollection");
        summary.put("features_count", features.size());
        summary.put("typename", data.get("typename"));
        summary.put("bbox_filter", data.get("bbox_filter"));
        summary.put("query_params", data.containsKey("query_params") ? data.get("query_params") : params);

        if (!features.isEmpty()) {
            Map<String, Object> sample = new LinkedHashMap<>(asMap(features.get(0)));
            if (sample.containsKey("geometry")) {
                Map<String, Object> geometry = asMap(sample.get("geometry"));
                Map<String, Object> light = new LinkedHashMap<>();
                light.put("type", geometry.get("type"));
                light.put("coordinates_count", coordinateTextLength(geometry.get("coordinates")));
                sample.put("geometry", light);
            }
            summary.put("sample_feature", sample);
        }
        return summary;
    }

    // longitud del texto JSON de las coordenadas
    private int coordinateTextLength(Object coordinates) {
        try {
            return mapper.writeValueAsString(coordinates == null ? List.of() : coordinates).length();
        } catch (JsonProcessingException e) {
            log.debug("Coordenadas no serializables: {}", e.getMessage());
            return 0;
        }
    }
}
