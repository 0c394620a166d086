package com.ogt.geodata.cache;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resumen ligero de un resultado, específico de cada {@link OperationKind}.
 */
public interface ResultSummarizer {

    OperationKind kind();

    Map<String, Object> summarize(Object result, Map<String, Object> params);

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : Collections.emptyList();
    }
}
