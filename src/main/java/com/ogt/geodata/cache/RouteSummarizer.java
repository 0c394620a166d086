package com.ogt.geodata.cache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.cache.ResultSummarizer.asList;
import static com.ogt.geodata.cache.ResultSummarizer.asMap;

/**
 * Itinerario: distancia, duración, extremos y una muestra de 2 puntos de la geometría.
 */
public class RouteSummarizer implements ResultSummarizer {

    @Override
    public OperationKind kind() {
        return OperationKind.ROUTE;
    }

    @Override
    public Map<String, Object> summarize(Object result, Map<String, Object> params) {
        Map<String, Object> data = asMap(result);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("distance", data.get("distance"));
        summary.put("duration", data.get("duration"));
        summary.put("bbox", data.get("bbox"));
        summary.put("start", data.get("start"));
        summary.put("end", data.get("end"));
        summary.put("profile", data.get("profile"));
        summary.put("resource", data.get("resource"));

        Map<String, Object> geometry = asMap(data.get("geometry"));
        if ("LineString".equals(geometry.get("type"))) {
            List<Object> coords = asList(geometry.get("coordinates"));
            summary.put("geometry_points_count", coords.size());
            if (!coords.isEmpty()) {
                Map<String, Object> sample = new LinkedHashMap<>();
                sample.put("type", "LineString");
                sample.put("coordinates", coords.size() >= 2 ? List.of(coords.get(0), coords.get(coords.size() - 1)) : coords);
                summary.put("geometry_sample", sample);
            }
        }

        int steps = 0;
        for (Object portion : asList(data.get("portions"))) {
            steps += asList(asMap(portion).get("steps")).size();
        }
        summary.put("steps_count", steps);
        return summary;
    }
}
