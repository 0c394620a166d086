package com.ogt.geodata.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Resultado voluminoso de una herramienta y los parámetros con los que se obtuvo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheRespondRequest {
    @NotNull(message = "El resultado es obligatorio")
    private Object result;

    private Map<String, Object> params;
}
