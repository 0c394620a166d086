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
public class ClipRequest {
    @NotBlank(message = "El campo data es obligatorio")
    private String data;

    @NotBlank(message = "El formato de entrada es obligatorio")
    private String inputFormat;

    @NotBlank(message = "El campo clip_data es obligatorio")
    private String clipData;

    @NotBlank(message = "El formato clip_format es obligatorio")
    private String clipFormat;

    private String sourceCrs;
    private String clipSourceCrs;
    private String targetCrs;
    private String outputFormat;
}
