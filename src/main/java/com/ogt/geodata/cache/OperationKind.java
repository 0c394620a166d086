package com.ogt.geodata.cache;

import java.util.Map;

/**
 * Familia de resultado, resuelta una vez a partir del nombre de la herramienta.
 */
public enum OperationKind {
    ROUTE(true),
    ISOCHRONE(true),
    FEATURE_COLLECTION(false),
    ELEVATION_PROFILE(true),
    GENERIC(false);

    private static final Map<String, OperationKind> BY_TOOL = Map.of(
            "calculate_route", ROUTE,
            "calculate_isochrone", ISOCHRONE,
            "calculate_isodistance", ISOCHRONE,
            "get_wfs_features", FEATURE_COLLECTION,
            "get_elevation_line", ELEVATION_PROFILE
    );

    private final boolean alwaysCached;

    OperationKind(boolean alwaysCached) {
        this.alwaysCached = alwaysCached;
    }

    /** Rutas, isócronas y perfiles producen secuencias largas: se cachean siempre. */
    public boolean isAlwaysCached() {
        return alwaysCached;
    }

    public static OperationKind fromToolName(String toolName) {
        return toolName == null ? GENERIC : BY_TOOL.getOrDefault(toolName, GENERIC);
    }
}
