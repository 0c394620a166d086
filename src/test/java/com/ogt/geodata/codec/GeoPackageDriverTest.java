package com.ogt.geodata.codec;

import com.ogt.geodata.GeodataFixtures;
import com.ogt.geodata.exception.ErrorKind;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import com.ogt.geodata.util.GeoJSONHelper;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import static com.ogt.geodata.GeodataFixtures.collection;
import static com.ogt.geodata.GeodataFixtures.feature;
import static com.ogt.geodata.GeodataFixtures.wkt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoPackageDriverTest {

    private final GeoPackageDriver driver = new GeoPackageDriver(GeodataFixtures.CRS_REGISTRY, GeodataFixtures.CRS_WKT);

    @Test
    void geometryBlobStartsWithStandardHeader() {
        byte[] blob = GeoPackageDriver.encodeGeometry(wkt("POINT (1 2)"), 4326, new WKBWriter(2, true));

        assertThat(blob[0]).isEqualTo((byte) 'G');
        assertThat(blob[1]).isEqualTo((byte) 'P');
        assertThat(blob[2]).isEqualTo((byte) 0);
        assertThat(blob[3] & 0x01).isEqualTo(1);
        assertThat(ByteBuffer.wrap(blob, 4, 4).order(ByteOrder.LITTLE_ENDIAN).getInt()).isEqualTo(4326);
    }

    @Test
    void decodeSkipsEnvelopeWhenPresent() {
        Geometry point = wkt("POINT (3 4)");
        byte[] wkb = new WKBWriter(2, true).write(point);
        ByteBuffer buf = ByteBuffer.allocate(8 + 32 + wkb.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) 'G').put((byte) 'P').put((byte) 0).put((byte) 0x03).putInt(4326);
        buf.putDouble(3).putDouble(3).putDouble(4).putDouble(4);
        buf.put(wkb);

        Geometry decoded = GeoPackageDriver.decodeGeometry(buf.array(), new WKBReader(GeoJSONHelper.geometryFactory()));

        assertThat(decoded.equalsExact(point)).isTrue();
    }

    @Test
    void blobWithoutMagicIsRejected() {
        assertThatThrownBy(() -> GeoPackageDriver.decodeGeometry(new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9},
                new WKBReader(GeoJSONHelper.geometryFactory())))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
    }

    @Test
    void attributesKeepTheirTypes() {
        FeatureCollection input = collection("EPSG:4326",
                feature("LINESTRING (0 0, 1 1)", "name", "A", "lanes", 2L, "speed", 50.5, "oneway", true),
                feature("LINESTRING (1 1, 2 2)", "name", "B", "lanes", null, "speed", 30.0, "oneway", false));

        List<Feature> back = driver.read(driver.write(input)).getFeatures();

        assertThat(back.get(0).getAttributes())
                .containsEntry("name", "A")
                .containsEntry("lanes", 2L)
                .containsEntry("speed", 50.5)
                .containsEntry("oneway", true);
        assertThat(back.get(1).getAttribute("lanes")).isNull();
        assertThat(back.get(1).getAttribute("oneway")).isEqualTo(false);
    }

    @Test
    void projectedCrsIsRegisteredInSpatialRefSys() {
        FeatureCollection input = collection("EPSG:32630", feature("POINT (440000 4474000)", "id", 1L));

        assertThat(driver.read(driver.write(input)).getCrs()).isEqualTo("EPSG:32630");
    }

    @Test
    void unknownCrsIsWrittenAsUndefined() {
        FeatureCollection input = collection(null, feature("POINT (1 1)", "id", 1L));

        assertThat(driver.read(driver.write(input)).getCrs()).isNull();
    }

    @Test
    void notAGeoPackageIsRejected() {
        assertThatThrownBy(() -> driver.read("aGVsbG8gd29ybGQ="))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
    }
}
