package com.ogt.geodata.service;

import com.ogt.geodata.GeodataFixtures;
import com.ogt.geodata.codec.FormatCodec;
import com.ogt.geodata.dto.BboxRequest;
import com.ogt.geodata.dto.BoundingBoxDTO;
import com.ogt.geodata.dto.BufferRequest;
import com.ogt.geodata.dto.ClipRequest;
import com.ogt.geodata.dto.ConvertRequest;
import com.ogt.geodata.dto.DissolveRequest;
import com.ogt.geodata.dto.ExplodeRequest;
import com.ogt.geodata.dto.GeodataEnvelope;
import com.ogt.geodata.dto.IntersectRequest;
import com.ogt.geodata.dto.ReprojectRequest;
import com.ogt.geodata.exception.ErrorKind;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.GeodataFixtures.squareFeature;
import static com.ogt.geodata.GeodataFixtures.squareGeoJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeometryOperationServiceTest {

    private final GeometryOperationService service = GeodataFixtures.operationService();
    private final FormatCodec codec = GeodataFixtures.formatCodec();

    private static final String DIAMOND = "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\","
            + "\"properties\":{\"name\":\"rombo\"},\"geometry\":{\"type\":\"Polygon\","
            + "\"coordinates\":[[[-1,0],[0,1],[1,0],[0,-1],[-1,0]]]}}]}";

    private static final String MERCATOR_CRS =
            "\"crs\":{\"type\":\"name\",\"properties\":{\"name\":\"urn:ogc:def:crs:EPSG::3857\"}},";

    private FeatureCollection decode(GeodataEnvelope envelope) {
        return codec.load(envelope.getPayload(), envelope.getFormat());
    }

    private static String features(String... features) {
        return "{\"type\":\"FeatureCollection\",\"features\":[" + String.join(",", features) + "]}";
    }

    // ============================================================
    // REPROYECCIÓN
    // ============================================================
    @Nested
    class Reproject {

        @Test
        void reprojectsAndDeclaresTheTargetCrs() {
            GeodataEnvelope out = service.reproject(ReprojectRequest.builder()
                    .data(GeodataFixtures.pointGeoJson(2.3522, 48.8566, "Paris"))
                    .inputFormat("geojson")
                    .targetCrs("EPSG:3857")
                    .build());

            assertThat(out.getCrs()).isEqualTo("EPSG:3857");
            assertThat(out.getPayload()).contains("urn:ogc:def:crs:EPSG::3857");
            FeatureCollection back = decode(out);
            assertThat(back.getFeatures().get(0).getGeometry().getCoordinate().x).isCloseTo(261845.7, within(1.0));
            assertThat(back.getFeatures().get(0).getAttribute("name")).isEqualTo("Paris");
        }

        @Test
        void targetCrsIsRequired() {
            assertThatThrownBy(() -> service.reproject(ReprojectRequest.builder()
                    .data(DIAMOND).inputFormat("geojson").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MISSING_PARAMETER);
        }

        @Test
        void outputFormatIsCheckedBeforeLoading() {
            assertThatThrownBy(() -> service.reproject(ReprojectRequest.builder()
                    .data("{broken").inputFormat("geojson").targetCrs("EPSG:3857").outputFormat("dxf").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.UNSUPPORTED_FORMAT);
        }
    }

    // ============================================================
    // BUFFER
    // ============================================================
    @Nested
    class Buffer {

        @Test
        void bufferInMetricCrsContainsOriginalSquare() {
            GeodataEnvelope out = service.buffer(BufferRequest.builder()
                    .data(DIAMOND)
                    .inputFormat("geojson")
                    .distance(500.0)
                    .bufferCrs("EPSG:3857")
                    .outputCrs("EPSG:4326")
                    .build());

            FeatureCollection result = decode(out);
            Envelope original = new Envelope(-1, 1, -1, 1);
            Envelope buffered = result.envelope();

            assertThat(out.getCrs()).isEqualTo("EPSG:4326");
            assertThat(buffered.getMinX()).isLessThan(original.getMinX());
            assertThat(buffered.getMinY()).isLessThan(original.getMinY());
            assertThat(buffered.getMaxX()).isGreaterThan(original.getMaxX());
            assertThat(buffered.getMaxY()).isGreaterThan(original.getMaxY());
            assertThat(result.getFeatures().get(0).getAttribute("name")).isEqualTo("rombo");
        }

        @Test
        void positiveDistanceGrowsAndNegativeShrinks() {
            String square = features(squareFeature(0, 0, 100, "\"id\":1")).replace("{\"type\":\"FeatureCollection\",",
                    "{\"type\":\"FeatureCollection\"," + MERCATOR_CRS);

            double grown = decode(service.buffer(BufferRequest.builder()
                    .data(square).inputFormat("geojson").distance(10.0).build()))
                    .getFeatures().get(0).getGeometry().getArea();
            double shrunk = decode(service.buffer(BufferRequest.builder()
                    .data(square).inputFormat("geojson").distance(-10.0).build()))
                    .getFeatures().get(0).getGeometry().getArea();

            assertThat(grown).isGreaterThanOrEqualTo(10_000.0);
            assertThat(shrunk).isCloseTo(6_400.0, within(1e-6));
        }

        @Test
        void flatCapsAndMitreJoinsAreApplied() {
            String line = "{\"type\":\"FeatureCollection\"," + MERCATOR_CRS + "\"features\":[{\"type\":\"Feature\","
                    + "\"properties\":{},\"geometry\":{\"type\":\"LineString\",\"coordinates\":[[0,0],[100,0]]}}]}";

            Geometry flat = decode(service.buffer(BufferRequest.builder()
                    .data(line).inputFormat("geojson").distance(5.0).capStyle("FLAT").joinStyle("mitre").build()))
                    .getFeatures().get(0).getGeometry();

            assertThat(flat.getArea()).isCloseTo(1_000.0, within(1e-6));
        }

        @Test
        void unknownStylesAreRejected() {
            assertThatThrownBy(() -> service.buffer(BufferRequest.builder()
                    .data(DIAMOND).inputFormat("geojson").distance(1.0).capStyle("butt").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.INVALID_STYLE_PARAMETER);
            assertThatThrownBy(() -> service.buffer(BufferRequest.builder()
                    .data(DIAMOND).inputFormat("geojson").distance(1.0).joinStyle("sharp").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.INVALID_STYLE_PARAMETER);
        }

        @Test
        void distanceIsRequired() {
            assertThatThrownBy(() -> service.buffer(BufferRequest.builder()
                    .data(DIAMOND).inputFormat("geojson").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MISSING_PARAMETER);
        }
    }

    // ============================================================
    // INTERSECCIÓN Y RECORTE
    // ============================================================
    @Nested
    class Intersect {

        private final String layerA = features(
                squareFeature(0, 0, 2, "\"id\":1,\"zone\":\"A\""),
                squareFeature(5, 5, 2, "\"id\":2,\"zone\":\"B\""));
        private final String layerB = features(
                squareFeature(1, 1, 2, "\"id\":10,\"use\":\"park\""),
                squareFeature(5.5, 5.5, 1, "\"id\":20,\"use\":\"school\""));

        private FeatureCollection intersect(String a, String b) {
            return decode(service.intersect(IntersectRequest.builder()
                    .dataA(a).inputFormatA("geojson")
                    .dataB(b).inputFormatB("geojson")
                    .build()));
        }

        @Test
        void isCommutativeUpToAttributeOrder() {
            FeatureCollection ab = intersect(layerA, layerB);
            FeatureCollection ba = intersect(layerB, layerA);

            assertThat(ab.size()).isEqualTo(ba.size()).isEqualTo(2);
            assertThat(union(ab).equalsTopo(union(ba))).isTrue();
            assertThat(union(ab).getArea()).isCloseTo(2.0, within(1e-9));
        }

        @Test
        void sharedAttributeNamesAreSuffixed() {
            Feature first = intersect(layerA, layerB).getFeatures().get(0);

            assertThat(first.getAttributes())
                    .containsEntry("id_1", 1L)
                    .containsEntry("id_2", 10L)
                    .containsEntry("zone", "A")
                    .containsEntry("use", "park");
        }

        @Test
        void disjointInputsAreEmptyResult() {
            assertThatThrownBy(() -> intersect(squareGeoJson(0, 0, 1, 1), squareGeoJson(10, 10, 1, 2)))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.EMPTY_RESULT);
        }

        @Test
        void secondInputIsAlignedToTheFirstCrs() {
            String mercatorSquare = features(squareFeature(0, 0, 200_000, "\"k\":1"))
                    .replace("{\"type\":\"FeatureCollection\",", "{\"type\":\"FeatureCollection\"," + MERCATOR_CRS);

            GeodataEnvelope out = service.intersect(IntersectRequest.builder()
                    .dataA(squareGeoJson(0, 0, 1, 1)).inputFormatA("geojson")
                    .dataB(mercatorSquare).inputFormatB("geojson")
                    .build());

            assertThat(out.getCrs()).isEqualTo("EPSG:4326");
            Envelope env = decode(out).envelope();
            assertThat(env.getMaxX()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        void clipKeepsAttributesAndDropsOutsideFeatures() {
            GeodataEnvelope out = service.clip(ClipRequest.builder()
                    .data(layerA).inputFormat("geojson")
                    .clipData(squareGeoJson(1, 1, 10, 99)).clipFormat("geojson")
                    .build());

            FeatureCollection clipped = decode(out);
            assertThat(clipped.size()).isEqualTo(2);
            assertThat(clipped.getFeatures().get(0).getAttributes()).containsEntry("zone", "A").doesNotContainKey("id_1");
            assertThat(clipped.getFeatures().get(0).getGeometry().getArea()).isCloseTo(1.0, within(1e-9));
            assertThat(clipped.getFeatures().get(1).getGeometry().getArea()).isCloseTo(4.0, within(1e-9));

            assertThatThrownBy(() -> service.clip(ClipRequest.builder()
                    .data(layerA).inputFormat("geojson")
                    .clipData(squareGeoJson(20, 20, 1, 1)).clipFormat("geojson")
                    .build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.EMPTY_RESULT);
        }

        private Geometry union(FeatureCollection collection) {
            List<Geometry> geometries = new ArrayList<>();
            collection.getFeatures().forEach(f -> geometries.add(f.getGeometry()));
            return UnaryUnionOp.union(geometries);
        }
    }

    // ============================================================
    // CONVERSIÓN Y BBOX
    // ============================================================
    @Test
    void convertRequiresOutputFormat() {
        assertThatThrownBy(() -> service.convert(ConvertRequest.builder().data(DIAMOND).inputFormat("geojson").build()))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.MISSING_PARAMETER);
    }

    @Test
    void convertThroughEveryFormatKeepsAttributes() {
        String payload = DIAMOND;
        String format = "geojson";
        for (String next : List.of("gpkg", "shapefile", "kml", "geojson")) {
            GeodataEnvelope out = service.convert(ConvertRequest.builder()
                    .data(payload).inputFormat(format).outputFormat(next).build());
            payload = out.getPayload();
            format = out.getFormat();
        }

        FeatureCollection back = codec.load(payload, format);
        assertThat(back.size()).isEqualTo(1);
        assertThat(back.getFeatures().get(0).getAttribute("name")).isEqualTo("rombo");
        assertThat(back.getFeatures().get(0).getGeometry().getArea()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void bboxCanBeReprojected() {
        BoundingBoxDTO plain = service.bbox(BboxRequest.builder().data(DIAMOND).inputFormat("geojson").build());
        BoundingBoxDTO mercator = service.bbox(BboxRequest.builder()
                .data(DIAMOND).inputFormat("geojson").targetCrs("EPSG:3857").build());

        assertThat(plain.getFormat()).isEqualTo("bbox");
        assertThat(plain.getCrs()).isEqualTo("EPSG:4326");
        assertThat(plain.getBounds().getMinx()).isEqualTo(-1.0);
        assertThat(plain.getBounds().getMaxy()).isEqualTo(1.0);
        assertThat(mercator.getCrs()).isEqualTo("EPSG:3857");
        assertThat(mercator.getBounds().getMaxx()).isCloseTo(111319.49, within(0.1));
    }

    // ============================================================
    // DISSOLVE Y EXPLODE
    // ============================================================
    @Nested
    class DissolveAndExplode {

        private final String parcels = features(
                squareFeature(0, 0, 1, "\"g\":\"b\",\"pop\":10,\"area\":1.5"),
                squareFeature(1, 0, 1, "\"g\":\"a\",\"pop\":5,\"area\":2.0"),
                squareFeature(2, 0, 1, "\"g\":\"b\",\"pop\":7,\"area\":0.5"),
                squareFeature(5, 5, 1, "\"g\":null,\"pop\":1,\"area\":1.0"));

        @Test
        void oneRowPerDistinctGroupValue() {
            FeatureCollection out = decode(service.dissolve(DissolveRequest.builder()
                    .data(parcels).inputFormat("geojson").by("g")
                    .aggregations(Map.of("pop", "sum", "area", "mean"))
                    .build()));

            assertThat(out.size()).isEqualTo(2);
            Feature a = out.getFeatures().get(0);
            Feature b = out.getFeatures().get(1);
            assertThat(a.getAttribute("g")).isEqualTo("a");
            assertThat(b.getAttributes()).containsEntry("g", "b").containsEntry("pop", 17L).containsEntry("area", 1.0);
            assertThat(b.getGeometry().getNumGeometries()).isEqualTo(2);
        }

        @Test
        void withoutByEverythingIsMerged() {
            FeatureCollection out = decode(service.dissolve(DissolveRequest.builder()
                    .data(parcels).inputFormat("geojson").build()));

            assertThat(out.size()).isEqualTo(1);
            assertThat(out.getFeatures().get(0).getGeometry().getArea()).isCloseTo(4.0, within(1e-9));
            assertThat(out.getFeatures().get(0).getAttribute("pop")).isEqualTo(10L);
        }

        @Test
        void unknownColumnsAndAggregationsAreRejected() {
            assertThatThrownBy(() -> service.dissolve(DissolveRequest.builder()
                    .data(parcels).inputFormat("geojson").by("district").build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThatThrownBy(() -> service.dissolve(DissolveRequest.builder()
                    .data(parcels).inputFormat("geojson").by("g").aggregations(Map.of("pop", "median")).build()))
                    .isInstanceOf(GeodataException.class)
                    .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
        }

        @Test
        void explodeProducesOneRowPerPart() {
            String multi = features(
                    "{\"type\":\"Feature\",\"properties\":{\"name\":\"islas\"},\"geometry\":{\"type\":\"MultiPolygon\","
                            + "\"coordinates\":[[[[0,0],[1,0],[1,1],[0,0]]],[[[2,2],[3,2],[3,3],[2,2]]],[[[4,4],[5,4],[5,5],[4,4]]]]}}",
                    "{\"type\":\"Feature\",\"properties\":{\"name\":\"faro\"},\"geometry\":{\"type\":\"Point\",\"coordinates\":[9,9]}}");

            FeatureCollection out = decode(service.explode(ExplodeRequest.builder()
                    .data(multi).inputFormat("geojson").build()));

            assertThat(out.size()).isEqualTo(4);
            for (int i = 0; i < 3; i++) {
                assertThat(out.getFeatures().get(i).getAttributes()).isEqualTo(Map.of("name", "islas"));
                assertThat(out.getFeatures().get(i).getGeometry().getGeometryType()).isEqualTo("Polygon");
            }
            assertThat(out.getFeatures().get(3).getAttribute("name")).isEqualTo("faro");
        }

        @Test
        void explodeCanRecordSourceAndPartIndex() {
            String multi = features("{\"type\":\"Feature\",\"properties\":{\"name\":\"x\"},\"geometry\":"
                    + "{\"type\":\"MultiPoint\",\"coordinates\":[[0,0],[1,1]]}}");

            FeatureCollection out = decode(service.explode(ExplodeRequest.builder()
                    .data(multi).inputFormat("geojson").keepIndex(true).build()));

            assertThat(out.getFeatures().get(1).getAttributes())
                    .containsEntry(GeometryOperationService.SOURCE_INDEX, 0L)
                    .containsEntry(GeometryOperationService.PART_INDEX, 1L);
        }
    }
}
