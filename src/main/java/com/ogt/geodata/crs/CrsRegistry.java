package com.ogt.geodata.crs;

import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolución de CRS y reproyección de geometrías JTS con proj4j.
 * <p>
 * Los CRS se identifican siempre como {@code EPSG:<code>}. Las definiciones se
 * cachean; las transformaciones se crean por llamada porque no son thread-safe.
 */
@Slf4j
@Component
public class CrsRegistry {

    public static final String WGS84 = "EPSG:4326";

    private static final Pattern EPSG_CODE = Pattern.compile("^(?:EPSG:{1,2})?(\\d+)$");
    private static final Pattern URN_EPSG = Pattern.compile("^URN:OGC:DEF:CRS:EPSG:[^:]*:(\\d+)$");

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final Map<String, CoordinateReferenceSystem> cache = new ConcurrentHashMap<>();

    /**
     * Normaliza un identificador de CRS a {@code EPSG:<code>} y verifica que exista.
     *
     * @return el CRS canónico, o {@code null} si la entrada es nula o vacía
     */
    public String canonicalize(String crs) {
        if (crs == null || crs.isBlank()) {
            return null;
        }
        String upper = crs.trim().toUpperCase(Locale.ROOT);
        String canonical;

        if (upper.equals("CRS84") || upper.equals("OGC:CRS84") || upper.endsWith(":CRS84")) {
            canonical = WGS84;
        } else {
            Matcher m = EPSG_CODE.matcher(upper);
            Matcher urn = URN_EPSG.matcher(upper);
            if (m.matches()) {
                canonical = "EPSG:" + parseCode(m.group(1), crs);
            } else if (urn.matches()) {
                canonical = "EPSG:" + parseCode(urn.group(1), crs);
            } else {
                throw GeodataException.incompatibleCrs("CRS no reconocido: " + crs + ". Use la forma EPSG:<código>.");
            }
        }

        resolve(canonical);
        return canonical;
    }

    private static int parseCode(String digits, String crs) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw GeodataException.incompatibleCrs("Código EPSG fuera de rango: " + crs);
        }
    }

    public int epsgCode(String canonicalCrs) {
        return Integer.parseInt(canonicalCrs.substring("EPSG:".length()));
    }

    /**
     * Definición proj4j de un CRS canónico (cacheada).
     */
    public CoordinateReferenceSystem resolve(String canonicalCrs) {
        return cache.computeIfAbsent(canonicalCrs, code -> {
            try {
                return crsFactory.createFromName(code);
            } catch (Proj4jException e) {
                throw GeodataException.incompatibleCrs("CRS desconocido: " + code + " (" + e.getMessage() + ")");
            }
        });
    }

    public boolean isGeographic(String canonicalCrs) {
        String params = resolve(canonicalCrs).getParameterString();
        return params != null && (params.contains("+proj=longlat") || params.contains("+proj=latlong"));
    }

    /**
     * Reproyecta toda la colección. Falla si la colección no tiene CRS conocido.
     */
    public FeatureCollection reproject(FeatureCollection collection, String targetCrs) {
        String target = canonicalize(targetCrs);
        if (!collection.hasCrs()) {
            throw GeodataException.incompatibleCrs(
                    "No se puede reproyectar hacia " + target + ": el CRS de origen es desconocido. Indique `source_crs`.");
        }
        if (collection.getCrs().equals(target)) {
            return collection;
        }

        CoordinateTransform transform = transformFactory.createTransform(resolve(collection.getCrs()), resolve(target));
        List<Feature> out = new ArrayList<>(collection.size());
        for (Feature f : collection.getFeatures()) {
            out.add(f.hasGeometry() ? f.withGeometry(transform(f.getGeometry(), transform)) : f);
        }

        log.debug("Reproyección {} -> {} ({} features)", collection.getCrs(), target, out.size());
        return new FeatureCollection(out, target);
    }

    /**
     * Transforma una geometría aislada entre dos CRS canónicos.
     */
    public Geometry transform(Geometry geometry, String sourceCrs, String targetCrs) {
        if (sourceCrs.equals(targetCrs)) {
            return geometry;
        }
        return transform(geometry, transformFactory.createTransform(resolve(sourceCrs), resolve(targetCrs)));
    }

    private Geometry transform(Geometry geometry, CoordinateTransform transform) {
        Geometry copy = geometry.copy();
        copy.apply(new ProjFilter(transform));
        return copy;
    }

    private static final class ProjFilter implements CoordinateSequenceFilter {

        private final CoordinateTransform transform;
        private final ProjCoordinate in = new ProjCoordinate(0, 0);
        private final ProjCoordinate out = new ProjCoordinate(0, 0);

        ProjFilter(CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter(CoordinateSequence seq, int i) {
            in.x = seq.getX(i);
            in.y = seq.getY(i);
            try {
                transform.transform(in, out);
            } catch (Proj4jException e) {
                throw GeodataException.processingFailure(
                        "Coordenada fuera del dominio del CRS (" + in.x + ", " + in.y + "): " + e.getMessage(), e);
            }
            seq.setOrdinate(i, 0, out.x);
            seq.setOrdinate(i, 1, out.y);
        }

        @Override
        public boolean isDone() {
            return false;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
