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
public class IntersectRequest {
    @NotBlank(message = "El campo data_a es obligatorio")
    private String dataA;

    @NotBlank(message = "El formato input_format_a es obligatorio")
    private String inputFormatA;

    @NotBlank(message = "El campo data_b es obligatorio")
    private String dataB;

    @NotBlank(message = "El formato input_format_b es obligatorio")
    private String inputFormatB;

    private String sourceCrsA;
    private String sourceCrsB;
    private String targetCrs;
    private String outputFormat;
}
