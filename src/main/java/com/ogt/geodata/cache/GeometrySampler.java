package com.ogt.geodata.cache;

import com.ogt.geodata.dto.SampledGeometryDTO;
import com.ogt.geodata.exception.GeodataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.ogt.geodata.cache.ResultSummarizer.asList;

/**
 * Vista previa de tamaño acotado de la geometría de una entrada de caché.
 * <p>
 * LineString y el anillo exterior de un Polygon se muestrean de forma uniforme
 * conservando siempre el primer y el último punto. Un MultiPolygon no se
 * muestrea: solo se devuelven conteos.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeometrySampler {

    public static final int DEFAULT_MAX_POINTS = 100;
    static final String EXPORT_MESSAGE =
            "Geometría demasiado compleja para extraer una muestra. Use la exportación de la caché para obtener el fichero completo.";

    private final ResultCache resultCache;

    /**
     * @throws GeodataException INVALID_PARAMETER si {@code maxPoints < 2}
     */
    public SampledGeometryDTO sample(String cacheId, int maxPoints) {
        if (maxPoints < 2) {
            throw GeodataException.invalidParameter(
                    "max_points debe ser al menos 2 (primer y último punto), recibido " + maxPoints);
        }
        CacheEntry entry = resultCache.get(cacheId);
        if (entry == null) {
            return null;
        }
        Map<String, Object> geometry = resultCache.loadGeometry(cacheId);
        if (geometry == null) {
            return null;
        }

        int max = maxPoints;
        String type = String.valueOf(geometry.get("type"));
        List<Object> coords = asList(geometry.get("coordinates"));

        SampledGeometryDTO.SampledGeometryDTOBuilder result = SampledGeometryDTO.builder()
                .cacheId(cacheId)
                .toolName(entry.getToolName())
                .geometryType(type)
                .bbox(geometry.get("bbox"));

        switch (type) {
            case "LineString":
                sampleSequence(result, coords, max, false);
                break;
            case "Polygon":
                sampleSequence(result, coords.isEmpty() ? List.of() : asList(coords.get(0)), max, true);
                break;
            case "MultiPolygon": {
                int points = 0;
                int rings = 0;
                for (Object polygon : coords) {
                    for (Object ring : asList(polygon)) {
                        points += asList(ring).size();
                        rings++;
                    }
                }
                result.totalPoints(points).polygonsCount(coords.size()).ringsCount(rings).message(EXPORT_MESSAGE);
                break;
            }
            default:
                result.totalPoints(countPoints(coords)).message(EXPORT_MESSAGE);
        }

        log.debug("Muestra de {} ({}) con máximo {} puntos", cacheId, type, max);
        return result.build();
    }

    public SampledGeometryDTO sample(String cacheId) {
        return sample(cacheId, DEFAULT_MAX_POINTS);
    }

    private static void sampleSequence(SampledGeometryDTO.SampledGeometryDTOBuilder result, List<Object> points,
                                       int max, boolean asRing) {
        int total = points.size();
        result.totalPoints(total);

        List<Object> selected;
        if (total <= max) {
            selected = points;
            result.sampled(false);
        } else {
            selected = new ArrayList<>(max);
            for (int index : sampleIndices(total, max)) {
                selected.add(points.get(index));
            }
            result.sampled(true).samplingRatio(max + "/" + total);
        }
        result.coordinates(asRing ? List.of(selected) : selected);
    }

    /**
     * Índices 0, floor(i·step) para i = 1..max-2 y total-1, con step = total/max.
     * Requiere {@code total > max >= 2}.
     */
    static int[] sampleIndices(int total, int max) {
        double step = (double) total / max;
        int[] indices = new int[max];
        indices[0] = 0;
        for (int i = 1; i < max - 1; i++) {
            indices[i] = (int) Math.floor(i * step);
        }
        indices[max - 1] = total - 1;
        return indices;
    }

    // hojas [x, y] dentro de arrays anidados
    private static int countPoints(Object node) {
        List<Object> list = asList(node);
        if (list.isEmpty()) {
            return 0;
        }
        if (list.get(0) instanceof Number) {
            return 1;
        }
        int total = 0;
        for (Object child : list) {
            total += countPoints(child);
        }
        return total;
    }
}
