package com.ogt.geodata.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BufferRequest {
    @NotBlank(message = "El campo data es obligatorio")
    private String data;

    @NotBlank(message = "El formato de entrada es obligatorio")
    private String inputFormat;

    private Double distance; // En unidades del CRS de trabajo; negativo = erosión
    private String sourceCrs;
    private String bufferCrs;
    private String outputCrs;
    private String outputFormat;

    private String capStyle;  // round | flat | square
    private String joinStyle; // round | mitre | miter | bevel
    private Double mitreLimit;
    private Boolean singleSided;

    @Builder.Default
    private Integer resolution = 16;
}
