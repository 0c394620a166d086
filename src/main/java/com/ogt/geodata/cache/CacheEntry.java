package com.ogt.geodata.cache;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Metadatos de un resultado cacheado ({@code <cache_id>_meta.json}). Nunca contiene el resultado completo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CacheEntry {
    private String cacheId;
    private String toolName;
    private Map<String, Object> params;
    private Instant createdAt;
    private Instant expiresAt;
    private String filePath;
    private long fileSizeBytes;
    private Map<String, Object> summary;
}
