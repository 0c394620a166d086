package com.ogt.geodata.service;

import com.ogt.geodata.exception.GeodataException;
import org.locationtech.jts.operation.buffer.BufferParameters;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Traducción de los nombres de estilo de buffer a los códigos de JTS.
 */
public final class BufferStyles {

    private static final Map<String, Integer> CAP_STYLES = new LinkedHashMap<>();
    private static final Map<String, Integer> JOIN_STYLES = new LinkedHashMap<>();

    static {
        CAP_STYLES.put("round", BufferParameters.CAP_ROUND);   // 1
        CAP_STYLES.put("flat", BufferParameters.CAP_FLAT);     // 2
        CAP_STYLES.put("square", BufferParameters.CAP_SQUARE); // 3

        JOIN_STYLES.put("round", BufferParameters.JOIN_ROUND); // 1
        JOIN_STYLES.put("mitre", BufferParameters.JOIN_MITRE); // 2
        JOIN_STYLES.put("miter", BufferParameters.JOIN_MITRE);
        JOIN_STYLES.put("bevel", BufferParameters.JOIN_BEVEL); // 3
    }

    private BufferStyles() {}

    public static int capStyle(String name) {
        return lookup("cap_style", name, CAP_STYLES, BufferParameters.CAP_ROUND);
    }

    public static int joinStyle(String name) {
        return lookup("join_style", name, JOIN_STYLES, BufferParameters.JOIN_ROUND);
    }

    /**
     * Parámetros JTS completos. {@code resolution} es el número de segmentos por cuadrante.
     */
    public static BufferParameters parameters(String capStyle, String joinStyle, Double mitreLimit,
                                              Boolean singleSided, Integer resolution) {
        int segments = resolution == null ? 16 : resolution;
        if (segments < 1) {
            throw GeodataException.invalidParameter("resolution debe ser >= 1 (recibido " + segments + ")");
        }
        BufferParameters params = new BufferParameters(segments, capStyle(capStyle), joinStyle(joinStyle),
                mitreLimit != null ? mitreLimit : BufferParameters.DEFAULT_MITRE_LIMIT);
        if (singleSided != null) {
            params.setSingleSided(singleSided);
        }
        return params;
    }

    private static int lookup(String parameter, String name, Map<String, Integer> table, int defaultCode) {
        if (name == null || name.isBlank()) {
            return defaultCode;
        }
        Integer code = table.get(name.trim().toLowerCase(Locale.ROOT));
        if (code == null) {
            throw GeodataException.invalidStyle(parameter, name, table.keySet());
        }
        return code;
    }
}
