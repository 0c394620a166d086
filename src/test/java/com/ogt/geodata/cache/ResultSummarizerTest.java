package com.ogt.geodata.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultSummarizerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toolNamesResolveToKinds() {
        assertThat(OperationKind.fromToolName("calculate_isodistance")).isEqualTo(OperationKind.ISOCHRONE);
        assertThat(OperationKind.fromToolName("get_wfs_features")).isEqualTo(OperationKind.FEATURE_COLLECTION);
        assertThat(OperationKind.fromToolName("search_addresses")).isEqualTo(OperationKind.GENERIC);
        assertThat(OperationKind.fromToolName(null)).isEqualTo(OperationKind.GENERIC);
    }

    @Test
    void routeSummaryKeepsEndpointsOnly() {
        Map<String, Object> route = new LinkedHashMap<>();
        route.put("distance", 5000);
        route.put("geometry", Map.of("type", "LineString",
                "coordinates", List.of(List.of(0, 0), List.of(1, 1), List.of(2, 2))));
        route.put("portions", List.of(Map.of("steps", List.of(1, 2, 3)), Map.of("steps", List.of(4))));

        Map<String, Object> summary = new RouteSummarizer().summarize(route, Map.of());

        assertThat(summary).containsEntry("geometry_points_count", 3).containsEntry("steps_count", 4);
        @SuppressWarnings("unchecked")
        Map<String, Object> sample = (Map<String, Object>) summary.get("geometry_sample");
        assertThat(sample.get("coordinates")).isEqualTo(List.of(List.of(0, 0), List.of(2, 2)));
    }

    @Test
    void multiPolygonIsochroneOnlyGetsCounts() {
        List<Object> ring = List.of(List.of(0, 0), List.of(1, 0), List.of(1, 1), List.of(0, 0));
        Map<String, Object> isochrone = Map.of(
                "time", 600,
                "geometry", Map.of("type", "MultiPolygon", "coordinates", List.of(List.of(ring), List.of(ring, ring))));

        Map<String, Object> summary = new IsochroneSummarizer().summarize(isochrone, Map.of());

        assertThat(summary)
                .containsEntry("polygons_count", 2)
                .containsEntry("rings_count", 3)
                .containsEntry("geometry_points_count", 12)
                .containsEntry("note", IsochroneSummarizer.MULTIPOLYGON_NOTE)
                .containsKey("bbox");
    }

    @Test
    void featureCollectionSampleHidesCoordinates() {
        Map<String, Object> feature = Map.of(
                "type", "Feature",
                "properties", Map.of("nom", "Lyon"),
                "geometry", Map.of("type", "Point", "coordinates", List.of(4.85, 45.75)));
        Map<String, Object> wfs = Map.of("features", List.of(feature, feature), "typename", "communes");

        Map<String, Object> summary = new FeatureCollectionSummarizer(mapper).summarize(wfs, Map.of("limit", 2));

        assertThat(summary).containsEntry("features_count", 2).containsEntry("query_params", Map.of("limit", 2));
        @SuppressWarnings("unchecked")
        Map<String, Object> sample = (Map<String, Object>) summary.get("sample_feature");
        assertThat(sample.get("geometry")).isEqualTo(Map.of("type", "Point", "coordinates_count", "[4.85,45.75]".length()));
        assertThat(sample.get("properties")).isEqualTo(Map.of("nom", "Lyon"));
    }

    @Test
    void elevationProfileReportsRangeAndFourPointSample() {
        List<Object> elevations = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            elevations.add(Map.of("lon", i, "lat", i, "z", 100.0 + i * 10));
        }

        Map<String, Object> summary = new ElevationProfileSummarizer().summarize(Map.of("elevations", elevations), Map.of());

        assertThat(summary)
                .containsEntry("points_count", 10)
                .containsEntry("altitude_min", 100.0)
                .containsEntry("altitude_max", 190.0)
                .containsEntry("altitude_range", 90.0);
        assertThat((List<?>) summary.get("elevations_sample")).hasSize(4);
    }

    @Test
    void genericSummaryListsTopLevelKeys() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("a", 1);
        result.put("b", "two");

        Map<String, Object> summary = new GenericSummarizer(mapper).summarize(result, Map.of());

        assertThat(summary).containsEntry("keys", List.of("a", "b"))
                .containsEntry("data_size_bytes", (long) "{\"a\":1,\"b\":\"two\"}".length());
    }
}
