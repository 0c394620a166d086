package com.ogt.geodata.codec;

import com.ogt.geodata.exception.ErrorKind;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

import static com.ogt.geodata.GeodataFixtures.collection;
import static com.ogt.geodata.GeodataFixtures.feature;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KmlDriverTest {

    private final KmlDriver driver = new KmlDriver();

    private static final String GOOGLE_EARTH_KML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <kml xmlns="http://www.opengis.net/kml/2.2">
              <Document>
                <Schema name="parcels" id="parcels">
                  <SimpleField name="area" type="double"/>
                  <SimpleField name="lot" type="int"/>
                  <SimpleField name="built" type="bool"/>
                </Schema>
                <Placemark>
                  <name>Parcela 7</name>
                  <description>Zona norte</description>
                  <ExtendedData>
                    <SchemaData schemaUrl="#parcels">
                      <SimpleData name="area">12.5</SimpleData>
                      <SimpleData name="lot">7</SimpleData>
                      <SimpleData name="built">1</SimpleData>
                    </SchemaData>
                    <Data name="owner"><value>Ayuntamiento</value></Data>
                  </ExtendedData>
                  <Polygon>
                    <outerBoundaryIs><LinearRing><coordinates>
                      0,0,0 10,0,0 10,10,0 0,10,0 0,0,0
                    </coordinates></LinearRing></outerBoundaryIs>
                    <innerBoundaryIs><LinearRing><coordinates>
                      2,2 4,2 4,4 2,4 2,2
                    </coordinates></LinearRing></innerBoundaryIs>
                  </Polygon>
                </Placemark>
                <Placemark>
                  <name>Pozo</name>
                  <Point><coordinates>-3.7,40.4</coordinates></Point>
                </Placemark>
              </Document>
            </kml>
            """;

    @Test
    void readsPlacemarksWithTypedExtendedData() {
        FeatureCollection parsed = driver.read(GOOGLE_EARTH_KML);

        assertThat(parsed.getCrs()).isEqualTo("EPSG:4326");
        assertThat(parsed.size()).isEqualTo(2);

        Feature parcel = parsed.getFeatures().get(0);
        assertThat(parcel.getAttributes())
                .containsEntry("Name", "Parcela 7")
                .containsEntry("Description", "Zona norte")
                .containsEntry("area", 12.5)
                .containsEntry("lot", 7L)
                .containsEntry("built", true)
                .containsEntry("owner", "Ayuntamiento");
        assertThat(((Polygon) parcel.getGeometry()).getNumInteriorRing()).isEqualTo(1);
        assertThat(parcel.getGeometry().getArea()).isEqualTo(96.0);

        Feature well = parsed.getFeatures().get(1);
        assertThat(well.getGeometry().getCoordinate().x).isEqualTo(-3.7);
        assertThat(well.getAttribute("lot")).isNull();
    }

    @Test
    void multiGeometryBecomesMultiPart() {
        String kml = "<kml><Placemark><MultiGeometry>"
                + "<Point><coordinates>1,1</coordinates></Point>"
                + "<Point><coordinates>2,2</coordinates></Point>"
                + "</MultiGeometry></Placemark></kml>";

        Feature f = driver.read(kml).getFeatures().get(0);

        assertThat(f.getGeometry().getGeometryType()).isEqualTo("MultiPoint");
        assertThat(f.getGeometry().getNumGeometries()).isEqualTo(2);
    }

    @Test
    void writtenDocumentDeclaresSchemaAndEscapesValues() {
        FeatureCollection input = collection("EPSG:4326",
                feature("POINT (1 2)", "label", "A & B <norte>", "rank", 3L));

        String kml = driver.write(input);

        assertThat(kml).contains("<SimpleField name=\"rank\" type=\"int\">");
        assertThat(kml).contains("A &amp; B &lt;norte&gt;");
        assertThat(driver.read(kml).getFeatures().get(0).getAttributes())
                .containsEntry("label", "A & B <norte>")
                .containsEntry("rank", 3L);
    }

    @Test
    void externalEntitiesAreNotExpanded() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE kml [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<kml><Placemark><name>&x;</name><Point><coordinates>1,1</coordinates></Point></Placemark></kml>";

        FeatureCollection parsed;
        try {
            parsed = driver.read(xxe);
        } catch (GeodataException e) {
            assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            return;
        }
        assertThat(String.valueOf(parsed.getFeatures().get(0).getAttribute("Name"))).doesNotContain("root:");
    }

    @Test
    void malformedXmlIsInvalidParameter() {
        assertThatThrownBy(() -> driver.read("<kml><Placemark>"))
                .isInstanceOf(GeodataException.class)
                .extracting("kind").isEqualTo(ErrorKind.INVALID_PARAMETER);
    }
}
