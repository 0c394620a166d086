package com.ogt.geodata.exception;

import lombok.Getter;

import java.util.Collection;

@Getter
public class GeodataException extends RuntimeException {

    private final ErrorKind kind;

    public GeodataException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GeodataException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GeodataException unsupportedFormat(String format) {
        return new GeodataException(ErrorKind.UNSUPPORTED_FORMAT,
                "Formato « " + format + " » no soportado. Formatos aceptados: geojson, json, kml, gpkg, shapefile.");
    }

    public static GeodataException missingParameter(String name) {
        return new GeodataException(ErrorKind.MISSING_PARAMETER, "El parámetro `" + name + "` es obligatorio.");
    }

    public static GeodataException invalidParameter(String message) {
        return new GeodataException(ErrorKind.INVALID_PARAMETER, message);
    }

    public static GeodataException invalidParameter(String message, Throwable cause) {
        return new GeodataException(ErrorKind.INVALID_PARAMETER, message, cause);
    }

    public static GeodataException emptyResult(String message) {
        return new GeodataException(ErrorKind.EMPTY_RESULT, message);
    }

    public static GeodataException incompatibleCrs(String message) {
        return new GeodataException(ErrorKind.INCOMPATIBLE_CRS, message);
    }

    public static GeodataException invalidStyle(String parameter, String value, Collection<String> allowed) {
        return new GeodataException(ErrorKind.INVALID_STYLE_PARAMETER,
                parameter + " « " + value + " » no válido. Valores aceptados: " + String.join(", ", allowed) + ".");
    }

    public static GeodataException notFound(String cacheId) {
        return new GeodataException(ErrorKind.NOT_FOUND, "Cache no encontrado o expirado: " + cacheId);
    }

    public static GeodataException processingFailure(String message, Throwable cause) {
        return new GeodataException(ErrorKind.PROCESSING_FAILURE, message, cause);
    }
}
