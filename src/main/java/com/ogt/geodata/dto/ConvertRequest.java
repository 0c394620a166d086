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
public class ConvertRequest {
    @NotBlank(message = "El campo data es obligatorio")
    private String data;

    @NotBlank(message = "El formato de entrada es obligatorio")
    private String inputFormat;

    private String outputFormat;
    private String sourceCrs;
}
