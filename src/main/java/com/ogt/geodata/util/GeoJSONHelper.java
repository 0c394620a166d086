package com.ogt.geodata.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.math.BigInteger;

/**
 * Helpers to convert JTS Geometry <-> GeoJSON nodes and JSON scalars <-> Java.
 */
public final class GeoJSONHelper {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DECIMALS = 10;

    private static final GeometryFactory GF = new GeometryFactory();

    private GeoJSONHelper() {}

    public static GeometryFactory geometryFactory() {
        return GF;
    }

    /** Convert JTS Geometry -> GeoJSON node (sin miembro crs) */
    public static JsonNode geometryToJson(Geometry geom) throws JsonProcessingException {
        if (geom == null) return null;
        GeoJsonWriter writer = new GeoJsonWriter(DECIMALS);
        writer.setEncodeCRS(false);
        return MAPPER.readTree(writer.write(geom));
    }

    /** Convert GeoJSON geometry node -> JTS Geometry */
    public static Geometry geoJsonToGeometry(JsonNode node) throws ParseException {
        if (node == null || node.isNull()) return null;
        Geometry geom = new GeoJsonReader(GF).read(node.toString());
        if (geom != null) geom.setSRID(0); // el CRS vive en la colección
        return geom;
    }

    /**
     * Valor JSON de una propiedad -> escalar Java. Objetos y arrays anidados se
     * conservan como texto JSON.
     */
    public static Object toScalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) {
            if (node.canConvertToLong()) return node.longValue();
            BigInteger big = node.bigIntegerValue();
            return big.doubleValue();
        }
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) return node.textValue();
        return node.toString();
    }

    /** Escalar Java -> nodo JSON */
    public static JsonNode fromScalar(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
