package com.ogt.geodata.exception;

/**
 * Tipos de error del pipeline geoespacial y de la caché.
 */
public enum ErrorKind {
    UNSUPPORTED_FORMAT,
    MISSING_PARAMETER,
    INVALID_PARAMETER,
    EMPTY_RESULT,
    INCOMPATIBLE_CRS,
    INVALID_STYLE_PARAMETER,
    NOT_FOUND,
    PROCESSING_FAILURE;

    /**
     * Errores de uso que se detectan antes de cualquier cálculo geométrico.
     */
    public boolean isUsageError() {
        return this != PROCESSING_FAILURE && this != NOT_FOUND && this != EMPTY_RESULT;
    }
}
