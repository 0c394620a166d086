package com.ogt.geodata.cache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.cache.ResultSummarizer.asList;
import static com.ogt.geodata.cache.ResultSummarizer.asMap;

/**
 * Perfil altimétrico: número de puntos, altitudes extremas y una muestra de 4 puntos.
 */
public class ElevationProfileSummarizer implements ResultSummarizer {

    @Override
    public OperationKind kind() {
        return OperationKind.ELEVATION_PROFILE;
    }

    @Override
    public Map<String, Object> summarize(Object result, Map<String, Object> params) {
        Map<String, Object> data = asMap(result);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("sampling", data.get("sampling"));
        summary.put("lon", data.get("lon"));
        summary.put("lat", data.get("lat"));

        List<Object> elevations = asList(data.get("elevations"));
        summary.put("points_count", elevations.size());

        Double min = null;
        Double max = null;
        for (Object e : elevations) {
            Object z = asMap(e).get("z");
            if (z instanceof Number n) {
                double v = n.doubleValue();
                min = min == null ? v : Math.min(min, v);
                max = max == null ? v : Math.max(max, v);
            }
        }
        if (min != null) {
            summary.put("altitude_min", min);
            summary.put("altitude_max", max);
            summary.put("altitude_range", max - min);
        }

        if (elevations.size() > 4) {
            List<Object> sample = new ArrayList<>(elevations.subList(0, 2));
            sample.addAll(elevations.subList(elevations.size() - 2, elevations.size()));
            summary.put("elevations_sample", sample);
        } else {
            summary.put("elevations_sample", elevations);
        }
        return summary;
    }
}
