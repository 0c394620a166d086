package com.ogt.geodata.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBoxDTO {
    @Builder.Default
    private String format = "bbox";

    private String crs;
    private Bounds bounds;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bounds {
        private double minx;
        private double miny;
        private double maxx;
        private double maxy;
    }
}
