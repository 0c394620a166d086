package com.ogt.geodata.cache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.cache.ResultSummarizer.asList;
import static com.ogt.geodata.cache.ResultSummarizer.asMap;

/**
 * Isócrona / isodistancia. Para MultiPolygon solo se dan conteos.
 */
public class IsochroneSummarizer implements ResultSummarizer {

    static final String MULTIPOLYGON_NOTE =
            "MultiPolygon demasiado complejo para resumir; use la exportación para obtener la geometría completa.";

    @Override
    public OperationKind kind() {
        return OperationKind.ISOCHRONE;
    }

    @Override
    public Map<String, Object> summarize(Object result, Map<String, Object> params) {
        Map<String, Object> data = asMap(result);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("point", data.get("point"));
        summary.put("time", data.get("time"));
        summary.put("distance", data.get("distance"));
        summary.put("direction", data.get("direction"));
        summary.put("profile", data.get("profile"));
        summary.put("resource", data.get("resource"));

        Map<String, Object> geometry = asMap(data.get("geometry"));
        List<Object> coords = asList(geometry.get("coordinates"));
        Object type = geometry.get("type");
        if ("Polygon".equals(type) && !coords.isEmpty()) {
            // solo el anillo exterior
            summary.put("geometry_points_count", asList(coords.get(0)).size());
        } else if ("MultiPolygon".equals(type)) {
            int points = 0;
            int rings = 0;
            for (Object polygon : coords) {
                for (Object ring : asList(polygon)) {
                    points += asList(ring).size();
                    rings++;
                }
            }
            summary.put("geometry_points_count", points);
            summary.put("polygons_count", coords.size());
            summary.put("rings_count", rings);
            summary.put("note", MULTIPOLYGON_NOTE);
        }
        summary.put("bbox", data.get("bbox"));
        return summary;
    }
}
