package com.ogt.geodata.service;

import com.ogt.geodata.codec.FormatCodec;
import com.ogt.geodata.codec.GeodataFormat;
import com.ogt.geodata.crs.CrsReconciler;
import com.ogt.geodata.crs.CrsRegistry;
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
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Operaciones geométricas sobre colecciones: decodifica, alinea CRS, opera y
 * vuelve a codificar. Sin estado; segura para uso concurrente.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeometryOperationService {

    public static final String SOURCE_INDEX = "source_index";
    public static final String PART_INDEX = "part_index";

    private final FormatCodec formatCodec;
    private final CrsRegistry crsRegistry;
    private final CrsReconciler crsReconciler;
    private final GeometryValidationService validationService;

    // ============================================================
    // 1. REPROYECCIÓN
    // ============================================================
    public GeodataEnvelope reproject(ReprojectRequest req) {
        requireText(req.getTargetCrs(), "target_crs");
        String target = crsRegistry.canonicalize(req.getTargetCrs());
        checkOutputFormat(req.getOutputFormat());

        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        FeatureCollection result = crsRegistry.reproject(input, target);

        log.info("🌍 reproject: {} entidades {} -> {}", result.size(), input.getCrs(), result.getCrs());
        return formatCodec.dump(result, req.getOutputFormat());
    }

    // ============================================================
    // 2. BUFFER
    // ============================================================
    public GeodataEnvelope buffer(BufferRequest req) {
        if (req.getDistance() == null) {
            throw GeodataException.missingParameter("distance");
        }
        BufferParameters params = BufferStyles.parameters(req.getCapStyle(), req.getJoinStyle(),
                req.getMitreLimit(), req.getSingleSided(), req.getResolution());
        String outputCrs = crsRegistry.canonicalize(req.getOutputCrs());
        checkOutputFormat(req.getOutputFormat());

        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        String workingCrs = crsReconciler.resolveWorkingCrs(input, req.getBufferCrs());
        FeatureCollection working = crsRegistry.reproject(input, workingCrs);

        List<Feature> buffered = new ArrayList<>(working.size());
        try {
            for (Feature f : working.getFeatures()) {
                buffered.add(f.withGeometry(BufferOp.bufferOp(f.getGeometry(), req.getDistance(), params)));
            }
        } catch (TopologyException | IllegalArgumentException e) {
            throw validationService.processingFailure("buffer", e, working);
        }

        FeatureCollection result = working.withFeatures(buffered);
        if (outputCrs != null) {
            result = crsRegistry.reproject(result, outputCrs);
        }
        log.info("⭕ buffer: {} entidades, distancia {} en {}", result.size(), req.getDistance(), workingCrs);
        return formatCodec.dump(result, req.getOutputFormat());
    }

    // ============================================================
    // 3. INTERSECCIÓN
    // ============================================================
    public GeodataEnvelope intersect(IntersectRequest req) {
        checkOutputFormat(req.getOutputFormat());
        FeatureCollection a = formatCodec.load(req.getDataA(), req.getInputFormatA(), req.getSourceCrsA());
        FeatureCollection b = formatCodec.load(req.getDataB(), req.getInputFormatB(), req.getSourceCrsB());
        CrsReconciler.Reconciled aligned = crsReconciler.reconcile(a, b, req.getTargetCrs());
        a = aligned.getPrimary();
        b = aligned.getSecondary();

        Set<String> namesA = a.attributeNames();
        Set<String> namesB = b.attributeNames();
        Set<String> shared = new LinkedHashSet<>(namesA);
        shared.retainAll(namesB);

        List<Feature> out = new ArrayList<>();
        try {
            for (Feature fa : a.getFeatures()) {
                Geometry ga = fa.getGeometry();
                Envelope envA = ga.getEnvelopeInternal();
                for (Feature fb : b.getFeatures()) {
                    Geometry gb = fb.getGeometry();
                    if (!envA.intersects(gb.getEnvelopeInternal()) || !ga.intersects(gb)) continue;

                    Geometry overlap = keepDimension(ga.intersection(gb), ga.getDimension());
                    if (overlap == null || overlap.isEmpty()) continue;

                    Map<String, Object> attributes = new LinkedHashMap<>();
                    for (String name : namesA) {
                        attributes.put(shared.contains(name) ? name + "_1" : name, fa.getAttribute(name));
                    }
                    for (String name : namesB) {
                        attributes.put(shared.contains(name) ? name + "_2" : name, fb.getAttribute(name));
                    }
                    out.add(Feature.of(attributes, overlap));
                }
            }
        } catch (TopologyException | IllegalArgumentException e) {
            throw validationService.processingFailure("intersect", e, a, b);
        }

        if (out.isEmpty()) {
            throw GeodataException.emptyResult("La intersección de los dos conjuntos de datos está vacía.");
        }
        log.info("✂️ intersect: {} x {} -> {} entidades", a.size(), b.size(), out.size());
        return formatCodec.dump(new FeatureCollection(out, a.getCrs()), req.getOutputFormat());
    }

    // ============================================================
    // 4. RECORTE (CLIP)
    // ============================================================
    public GeodataEnvelope clip(ClipRequest req) {
        checkOutputFormat(req.getOutputFormat());
        FeatureCollection data = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        FeatureCollection mask = formatCodec.load(req.getClipData(), req.getClipFormat(), req.getClipSourceCrs());
        CrsReconciler.Reconciled aligned = crsReconciler.reconcile(data, mask, req.getTargetCrs());
        data = aligned.getPrimary();
        mask = aligned.getSecondary();

        List<Feature> out = new ArrayList<>();
        try {
            List<Geometry> maskGeometries = new ArrayList<>(mask.size());
            mask.getFeatures().forEach(f -> maskGeometries.add(f.getGeometry()));
            Geometry maskUnion = UnaryUnionOp.union(maskGeometries);

            for (Feature f : data.getFeatures()) {
                Geometry g = f.getGeometry();
                if (!g.getEnvelopeInternal().intersects(maskUnion.getEnvelopeInternal()) || !g.intersects(maskUnion)) {
                    continue;
                }
                Geometry clipped = g.intersection(maskUnion);
                if (!clipped.isEmpty()) {
                    out.add(f.withGeometry(clipped));
                }
            }
        } catch (TopologyException | IllegalArgumentException e) {
            throw validationService.processingFailure("clip", e, data, mask);
        }

        log.info("✂️ clip: {} entidades, {} conservadas", data.size(), out.size());
        return formatCodec.dump(data.withFeatures(out), req.getOutputFormat());
    }

    // ============================================================
    // 5. CONVERSIÓN DE FORMATO
    // ============================================================
    public GeodataEnvelope convert(ConvertRequest req) {
        requireText(req.getOutputFormat(), "output_format");
        checkOutputFormat(req.getOutputFormat());

        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        log.info("🔄 convert: {} entidades {} -> {}", input.size(), req.getInputFormat(), req.getOutputFormat());
        return formatCodec.dump(input, req.getOutputFormat());
    }

    // ============================================================
    // 6. BOUNDING BOX
    // ============================================================
    public BoundingBoxDTO bbox(BboxRequest req) {
        String target = crsRegistry.canonicalize(req.getTargetCrs());
        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        if (target != null) {
            input = crsRegistry.reproject(input, target);
        }
        Envelope env = input.envelope();
        return BoundingBoxDTO.builder()
                .crs(input.getCrs())
                .bounds(new BoundingBoxDTO.Bounds(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY()))
                .build();
    }

    // ============================================================
    // 7. DISSOLVE
    // ============================================================
    public GeodataEnvelope dissolve(DissolveRequest req) {
        checkOutputFormat(req.getOutputFormat());
        Map<String, DissolveAggregation> reductions = new LinkedHashMap<>();
        if (req.getAggregations() != null) {
            req.getAggregations().forEach((name, fn) -> reductions.put(name, DissolveAggregation.parse(fn)));
        }

        String target = crsRegistry.canonicalize(req.getTargetCrs());

        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());
        if (target != null) {
            input = crsRegistry.reproject(input, target);
        }

        String by = req.getBy() == null || req.getBy().isBlank() ? null : req.getBy();
        Set<String> names = input.attributeNames();
        if (by != null && !names.contains(by)) {
            throw GeodataException.invalidParameter("El atributo `by` « " + by + " » no existe en los datos.");
        }
        for (String name : reductions.keySet()) {
            if (!names.contains(name)) {
                throw GeodataException.invalidParameter("El atributo « " + name + " » de aggregations no existe en los datos.");
            }
        }

        Map<Object, List<Feature>> groups = new TreeMap<>(GROUP_KEY_ORDER);
        int dropped = 0;
        for (Feature f : input.getFeatures()) {
            Object key = by == null ? "" : f.getAttribute(by);
            if (key == null) {
                dropped++;
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(f);
        }
        if (dropped > 0) {
            log.warn("⚠️ dissolve: {} entidades sin valor en « {} » descartadas", dropped, by);
        }

        List<Feature> out = new ArrayList<>(groups.size());
        for (Map.Entry<Object, List<Feature>> group : groups.entrySet()) {
            List<Feature> members = group.getValue();
            Map<String, Object> attributes = new LinkedHashMap<>();
            if (by != null) {
                attributes.put(by, group.getKey());
            }
            for (String name : names) {
                if (name.equals(by)) continue;
                List<Object> values = new ArrayList<>(members.size());
                members.forEach(m -> values.add(m.getAttribute(name)));
                attributes.put(name, reductions.getOrDefault(name, DissolveAggregation.FIRST).apply(name, values));
            }

            List<Geometry> geometries = new ArrayList<>(members.size());
            members.forEach(m -> geometries.add(m.getGeometry()));
            try {
                out.add(Feature.of(attributes, UnaryUnionOp.union(geometries)));
            } catch (TopologyException | IllegalArgumentException e) {
                throw validationService.processingFailure("dissolve", e, input);
            }
        }

        log.info("🧩 dissolve: {} entidades -> {} grupos (by={})", input.size(), out.size(), by);
        return formatCodec.dump(input.withFeatures(out), req.getOutputFormat());
    }

    // ============================================================
    // 8. EXPLODE
    // ============================================================
    public GeodataEnvelope explode(ExplodeRequest req) {
        checkOutputFormat(req.getOutputFormat());
        FeatureCollection input = formatCodec.load(req.getData(), req.getInputFormat(), req.getSourceCrs());

        List<Feature> out = new ArrayList<>();
        List<Feature> features = input.getFeatures();
        for (int i = 0; i < features.size(); i++) {
            Feature f = features.get(i);
            Geometry g = f.getGeometry();
            int parts = g instanceof GeometryCollection ? g.getNumGeometries() : 1;
            for (int p = 0; p < parts; p++) {
                Geometry part = g instanceof GeometryCollection ? g.getGeometryN(p) : g;
                if (req.isKeepIndex()) {
                    Map<String, Object> attributes = new LinkedHashMap<>(f.getAttributes());
                    attributes.put(SOURCE_INDEX, (long) i);
                    attributes.put(PART_INDEX, (long) p);
                    out.add(Feature.of(attributes, part));
                } else {
                    out.add(f.withGeometry(part));
                }
            }
        }

        log.info("💥 explode: {} entidades -> {} partes", input.size(), out.size());
        return formatCodec.dump(input.withFeatures(out), req.getOutputFormat());
    }

    // ============================================================
    // HELPERS
    // ============================================================

    /**
     * Conserva solo las partes de la dimensión indicada (p.ej. polígonos de una
     * intersección polígono-polígono que además toca en un borde).
     */
    private static Geometry keepDimension(Geometry geometry, int dimension) {
        if (geometry.getClass() != GeometryCollection.class) {
            return geometry.getDimension() == dimension ? geometry : null;
        }
        List<Geometry> kept = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part.getDimension() == dimension && !part.isEmpty()) {
                kept.add(part);
            }
        }
        return kept.isEmpty() ? null : geometry.getFactory().buildGeometry(kept);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw GeodataException.missingParameter(name);
        }
    }

    private static void checkOutputFormat(String outputFormat) {
        if (outputFormat != null && !outputFormat.isBlank()) {
            GeodataFormat.parse(outputFormat);
        }
    }

    // Números entre sí por valor; tipos distintos por nombre de clase
    @SuppressWarnings("unchecked")
    private static final Comparator<Object> GROUP_KEY_ORDER = (x, y) -> {
        if (x instanceof Number && y instanceof Number) {
            return Double.compare(((Number) x).doubleValue(), ((Number) y).doubleValue());
        }
        if (x.getClass() == y.getClass() && x instanceof Comparable) {
            return ((Comparable<Object>) x).compareTo(y);
        }
        return x.getClass().getName().compareTo(y.getClass().getName());
    };
}
