package com.ogt.geodata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cualquier otro resultado: tamaño serializado y claves de primer nivel.
 */
@RequiredArgsConstructor
public class GenericSummarizer implements ResultSummarizer {

    private final ObjectMapper mapper;

    @Override
    public OperationKind kind() {
        return OperationKind.GENERIC;
    }

    @Override
    public Map<String, Object> summarize(Object result, Map<String, Object> params) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("data_size_bytes", serializedSize(mapper, result));
        summary.put("keys", result instanceof Map ? new ArrayList<>(((Map<?, ?>) result).keySet()) : null);
        return summary;
    }

    static long serializedSize(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Resultado no serializable a JSON: " + e.getOriginalMessage(), e);
        }
    }
}
