package com.ogt.geodata.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sobre de intercambio: formato, codificación del payload, CRS y contenido.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeodataEnvelope {
    private String format;
    private String encoding;
    private String crs;
    private String payload;
}
