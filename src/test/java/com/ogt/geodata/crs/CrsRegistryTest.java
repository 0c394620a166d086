package com.ogt.geodata.crs;

import com.ogt.geodata.exception.ErrorKind;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.FeatureCollection;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static com.ogt.geodata.GeodataFixtures.collection;
import static com.ogt.geodata.GeodataFixtures.feature;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CrsRegistryTest {

    private final CrsRegistry registry = new CrsRegistry();

    @Test
    void canonicalizesCommonSpellings() {
        assertThat(registry.canonicalize("epsg:3857")).isEqualTo("EPSG:3857");
        assertThat(registry.canonicalize("4326")).isEqualTo("EPSG:4326");
        assertThat(registry.canonicalize("urn:ogc:def:crs:EPSG::2154")).isEqualTo("EPSG:2154");
        assertThat(registry.canonicalize("urn:ogc:def:crs:OGC:1.3:CRS84")).isEqualTo("EPSG:4326");
        assertThat(registry.canonicalize(" ")).isNull();
        assertThat(registry.canonicalize(null)).isNull();
    }

    @Test
    void unknownCrsIsIncompatible() {
        assertThatThrownBy(() -> registry.canonicalize("EPSG:999999"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INCOMPATIBLE_CRS);
        assertThatThrownBy(() -> registry.canonicalize("Lambert"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INCOMPATIBLE_CRS);
    }

    @Test
    void overlongEpsgCodeIsIncompatible() {
        assertThatThrownBy(() -> registry.canonicalize("EPSG:99999999999999999999"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INCOMPATIBLE_CRS);
        assertThatThrownBy(() -> registry.canonicalize("urn:ogc:def:crs:EPSG::99999999999999999999"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INCOMPATIBLE_CRS);
    }

    @Test
    void reprojectsToWebMercator() {
        FeatureCollection wgs84 = collection("EPSG:4326", feature("POINT (2.3522 48.8566)", "city", "Paris"));

        FeatureCollection mercator = registry.reproject(wgs84, "EPSG:3857");

        Coordinate c = mercator.getFeatures().get(0).getGeometry().getCoordinate();
        assertThat(mercator.getCrs()).isEqualTo("EPSG:3857");
        assertThat(c.x).isCloseTo(261845.7, within(1.0));
        assertThat(c.y).isCloseTo(6250566.7, within(1.0));
        assertThat(mercator.getFeatures().get(0).getAttribute("city")).isEqualTo("Paris");
        // la colección de entrada no se modifica
        assertThat(wgs84.getFeatures().get(0).getGeometry().getCoordinate().x).isEqualTo(2.3522);
    }

    @Test
    void reprojectingWithoutSourceCrsFails() {
        assertThatThrownBy(() -> registry.reproject(collection(null, feature("POINT (1 1)")), "EPSG:3857"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INCOMPATIBLE_CRS);
    }

    @Test
    void detectsGeographicCrs() {
        assertThat(registry.isGeographic("EPSG:4326")).isTrue();
        assertThat(registry.isGeographic("EPSG:3857")).isFalse();
    }
}
