package com.ogt.geodata.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vista muestreada de la geometría de una entrada de caché. Nunca se persiste.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SampledGeometryDTO {
    private String cacheId;
    private String toolName;
    private String geometryType;
    private Integer totalPoints;
    private Object coordinates;
    private Boolean sampled;
    private String samplingRatio; // "max/total", solo si se muestreó
    private Integer polygonsCount;
    private Integer ringsCount;
    private String message;
    private Object bbox;
}
