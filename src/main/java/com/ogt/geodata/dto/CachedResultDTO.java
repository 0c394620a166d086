package com.ogt.geodata.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Respuesta ligera devuelta en lugar de un resultado voluminoso.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CachedResultDTO {
    @Builder.Default
    private boolean cached = true;

    private String cacheId;
    private String filePath;
    private double fileSizeKb;
    private Instant expiresAt;
    private Map<String, Object> summary;
    private String usage; // cómo recuperar los datos
}
