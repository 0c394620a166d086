package com.ogt.geodata.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DissolveRequest {
    @NotBlank(message = "El campo data es obligatorio")
    private String data;

    @NotBlank(message = "El formato de entrada es obligatorio")
    private String inputFormat;

    private String by; // null = fusionar todo en una entidad

    // atributo -> first | last | sum | mean | min | max | count
    private Map<String, String> aggregations;

    private String sourceCrs;
    private String targetCrs;
    private String outputFormat;
}
