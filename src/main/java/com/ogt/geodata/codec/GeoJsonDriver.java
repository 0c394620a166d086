package com.ogt.geodata.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ogt.geodata.crs.CrsRegistry;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import com.ogt.geodata.util.GeoJSONHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GeoJSON (RFC 7946). Acepta FeatureCollection, Feature o geometría suelta.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoJsonDriver implements FormatDriver {

    private static final Set<String> GEOMETRY_TYPES = Set.of(
            "Point", "MultiPoint", "LineString", "MultiLineString", "Polygon", "MultiPolygon", "GeometryCollection");

    private final CrsRegistry crsRegistry;

    @Override
    public GeodataFormat format() {
        return GeodataFormat.GEOJSON;
    }

    @Override
    public FeatureCollection read(String payload) {
        ObjectMapper mapper = GeoJSONHelper.mapper();
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw GeodataException.invalidParameter("GeoJSON inválido: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw GeodataException.invalidParameter("GeoJSON inválido: se esperaba un objeto JSON.");
        }

        String type = root.path("type").asText("");
        List<Feature> features = new ArrayList<>();

        if ("FeatureCollection".equals(type)) {
            JsonNode array = root.path("features");
            if (!array.isArray()) {
                throw GeodataException.invalidParameter("GeoJSON inválido: `features` debe ser un array.");
            }
            for (JsonNode node : array) {
                features.add(readFeature(node));
            }
        } else if ("Feature".equals(type)) {
            features.add(readFeature(root));
        } else if (GEOMETRY_TYPES.contains(type)) {
            features.add(Feature.of(Map.of(), parseGeometry(root)));
        } else {
            throw GeodataException.invalidParameter("GeoJSON inválido: tipo « " + type + " » no reconocido.");
        }

        return new FeatureCollection(features, readCrs(root));
    }

    @Override
    public String write(FeatureCollection collection) {
        ObjectMapper mapper = GeoJSONHelper.mapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "FeatureCollection");

        if (collection.hasCrs() && !CrsRegistry.WGS84.equals(collection.getCrs())) {
            ObjectNode crs = root.putObject("crs");
            crs.put("type", "name");
            crs.putObject("properties").put("name",
                    "urn:ogc:def:crs:EPSG::" + crsRegistry.epsgCode(collection.getCrs()));
        }

        ArrayNode array = root.putArray("features");
        int index = 0;
        try {
            for (Feature f : collection.getFeatures()) {
                ObjectNode node = array.addObject();
                node.put("type", "Feature");
                node.put("id", String.valueOf(index++));
                ObjectNode props = node.putObject("properties");
                f.getAttributes().forEach((k, v) -> props.set(k, GeoJSONHelper.fromScalar(v)));
                node.set("geometry", f.hasGeometry() ? GeoJSONHelper.geometryToJson(f.getGeometry()) : null);
            }
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw GeodataException.processingFailure("Error serializando GeoJSON: " + e.getOriginalMessage(), e);
        }
    }

    private Feature readFeature(JsonNode node) {
        if (!node.isObject()) {
            throw GeodataException.invalidParameter("GeoJSON inválido: cada feature debe ser un objeto.");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        JsonNode props = node.path("properties");
        if (props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                attributes.put(e.getKey(), GeoJSONHelper.toScalar(e.getValue()));
            }
        }
        JsonNode geometry = node.get("geometry");
        return Feature.of(attributes, geometry == null || geometry.isNull() ? null : parseGeometry(geometry));
    }

    private Geometry parseGeometry(JsonNode node) {
        try {
            return GeoJSONHelper.geoJsonToGeometry(node);
        } catch (ParseException | RuntimeException e) {
            throw GeodataException.invalidParameter("Geometría GeoJSON inválida: " + e.getMessage(), e);
        }
    }

    private String readCrs(JsonNode root) {
        JsonNode name = root.path("crs").path("properties").path("name");
        if (name.isTextual()) {
            return crsRegistry.canonicalize(name.asText());
        }
        return CrsRegistry.WGS84;
    }
}
