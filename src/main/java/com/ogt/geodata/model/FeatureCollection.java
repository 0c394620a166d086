package com.ogt.geodata.model;

import lombok.Getter;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Colección ordenada de features con un CRS asociado (nulo si es desconocido).
 * El CRS se guarda siempre en forma canónica {@code EPSG:<code>}.
 */
@Getter
public class FeatureCollection {

    private final List<Feature> features;
    private final String crs;

    public FeatureCollection(List<Feature> features, String crs) {
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        this.crs = crs;
    }

    public FeatureCollection withCrs(String newCrs) {
        return new FeatureCollection(features, newCrs);
    }

    public FeatureCollection withFeatures(List<Feature> newFeatures) {
        return new FeatureCollection(newFeatures, crs);
    }

    /** Copia sin las filas de geometría nula. */
    public FeatureCollection withoutNullGeometries() {
        List<Feature> kept = features.stream().filter(Feature::hasGeometry).collect(Collectors.toList());
        return kept.size() == features.size() ? this : withFeatures(kept);
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public boolean hasCrs() {
        return crs != null;
    }

    /** Nombres de atributo en orden de primera aparición. */
    public Set<String> attributeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Feature f : features) {
            names.addAll(f.getAttributes().keySet());
        }
        return names;
    }

    public List<Object> columnValues(String name) {
        List<Object> values = new ArrayList<>(features.size());
        for (Feature f : features) {
            values.add(f.getAttribute(name));
        }
        return values;
    }

    public AttributeType columnType(String name) {
        return AttributeType.infer(columnValues(name));
    }

    public Envelope envelope() {
        Envelope env = new Envelope();
        for (Feature f : features) {
            if (f.hasGeometry()) {
                env.expandToInclude(f.getGeometry().getEnvelopeInternal());
            }
        }
        return env;
    }
}
