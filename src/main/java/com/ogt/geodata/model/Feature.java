package com.ogt.geodata.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Una fila de la colección: atributos escalares + geometría.
 */
@Getter
@With
@ToString
@AllArgsConstructor
public class Feature {

    private final Map<String, Object> attributes;
    private final Geometry geometry;

    public static Feature of(Map<String, Object> attributes, Geometry geometry) {
        return new Feature(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), geometry);
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasGeometry() {
        return geometry != null;
    }
}
