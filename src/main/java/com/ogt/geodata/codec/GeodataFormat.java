package com.ogt.geodata.codec;

import com.ogt.geodata.exception.GeodataException;

import java.util.Locale;

public enum GeodataFormat {
    GEOJSON("geojson", false),
    KML("kml", false),
    GPKG("gpkg", true),
    SHAPEFILE("shapefile", true);

    public static final String UTF8 = "utf8";
    public static final String BASE64 = "base64";

    private final String id;
    private final boolean binary;

    GeodataFormat(String id, boolean binary) {
        this.id = id;
        this.binary = binary;
    }

    public String id() {
        return id;
    }

    public boolean isBinary() {
        return binary;
    }

    /** Codificación del payload en el sobre: base64 para binarios, utf8 para texto. */
    public String encoding() {
        return binary ? BASE64 : UTF8;
    }

    /**
     * Parsea un nombre de formato (sin distinguir mayúsculas; {@code json} es alias de {@code geojson}).
     */
    public static GeodataFormat parse(String format) {
        if (format == null || format.isBlank()) {
            throw GeodataException.missingParameter("format");
        }
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("json")) {
            return GEOJSON;
        }
        for (GeodataFormat f : values()) {
            if (f.id.equals(normalized)) {
                return f;
            }
        }
        throw GeodataException.unsupportedFormat(format);
    }
}
