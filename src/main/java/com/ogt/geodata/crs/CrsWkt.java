package com.ogt.geodata.crs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Definiciones WKT para los ficheros .prj y la tabla gpkg_spatial_ref_sys.
 * <p>
 * El WKT generado es compacto: nombre, parámetros PROJ en una EXTENSION y la
 * autoridad EPSG al final, que es lo que se relee.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrsWkt {

    private static final Pattern AUTHORITY = Pattern.compile("AUTHORITY\\[\\s*\"EPSG\"\\s*,\\s*\"?(\\d+)\"?\\s*]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ROOT_NAME = Pattern.compile("^\\s*(?:PROJCS|GEOGCS)\\[\\s*\"([^\"]+)\"");

    // Nombres ESRI frecuentes sin AUTHORITY
    private static final Map<String, Integer> ESRI_NAMES = Map.of(
            "GCS_WGS_1984", 4326,
            "WGS_1984_WEB_MERCATOR_AUXILIARY_SPHERE", 3857,
            "WGS_84_PSEUDO_MERCATOR", 3857,
            "RGF_1993_LAMBERT_93", 2154,
            "RGF93_LAMBERT_93", 2154,
            "GCS_RGF_1993", 4171,
            "ETRS_1989_LAEA", 3035
    );

    private final CrsRegistry crsRegistry;

    public String toWkt(String canonicalCrs) {
        int code = crsRegistry.epsgCode(canonicalCrs);
        String proj = crsRegistry.resolve(canonicalCrs).getParameterString().trim();
        String extension = ",EXTENSION[\"PROJ4\",\"" + proj + "\"]";
        String authority = ",AUTHORITY[\"EPSG\",\"" + code + "\"]";

        if (crsRegistry.isGeographic(canonicalCrs)) {
            return "GEOGCS[\"" + canonicalCrs + "\",PRIMEM[\"Greenwich\",0],UNIT[\"degree\",0.0174532925199433]"
                    + extension + authority + "]";
        }
        return "PROJCS[\"" + canonicalCrs + "\",GEOGCS[\"unnamed\",PRIMEM[\"Greenwich\",0],"
                + "UNIT[\"degree\",0.0174532925199433]],UNIT[\"metre\",1]" + extension + authority + "]";
    }

    /**
     * Extrae el CRS de un WKT: la autoridad EPSG de más alto nivel (la última en WKT1)
     * o, en su defecto, un nombre ESRI conocido.
     *
     * @return CRS canónico o {@code null} si no se reconoce
     */
    public String fromWkt(String wkt) {
        if (wkt == null || wkt.isBlank()) {
            return null;
        }
        Matcher m = AUTHORITY.matcher(wkt);
        String code = null;
        while (m.find()) {
            code = m.group(1);
        }
        if (code != null) {
            return crsRegistry.canonicalize("EPSG:" + code);
        }

        Matcher name = ROOT_NAME.matcher(wkt);
        if (name.find()) {
            Integer known = ESRI_NAMES.get(name.group(1).toUpperCase().replace(' ', '_'));
            if (known != null) {
                return "EPSG:" + known;
            }
        }
        log.warn("WKT sin autoridad EPSG reconocible, CRS desconocido: {}", abbreviate(wkt));
        return null;
    }

    private static String abbreviate(String s) {
        return s.length() > 120 ? s.substring(0, 120) + "..." : s;
    }
}
