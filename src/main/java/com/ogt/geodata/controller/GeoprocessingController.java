package com.ogt.geodata.controller;

import com.ogt.geodata.config.OpenApiConfig;
import com.ogt.geodata.dto.BboxRequest;
import com.ogt.geodata.dto.BoundingBoxDTO;
import com.ogt.geodata.dto.BufferRequest;
import com.ogt.geodata.dto.ClipRequest;
import com.ogt.geodata.dto.ConvertRequest;
import com.ogt.geodata.dto.DissolveRequest;
import com.ogt.geodata.dto.ExplodeRequest;
import com.ogt.geodata.dto.GeodataEnvelope;
import com.ogt.geodata.dto.IntersectRequest;
import com.ogt.geodata.dto.ReprojectRequest;
import com.ogt.geodata.worker.GeoprocessingWorker;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

@RestController
@Tag(name = OpenApiConfig.TAG_GEOPROCESSING)
@RequestMapping("/api/geodata")
@RequiredArgsConstructor
public class GeoprocessingController {

    private final GeoprocessingWorker worker;

    // 1. Reproyección
    @PostMapping("/reproject")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> reproject(@RequestBody @Valid ReprojectRequest request) {
        return worker.reproject(request).thenApply(ResponseEntity::ok);
    }

    // 2. Buffer (distancia en unidades del CRS de trabajo)
    @PostMapping("/buffer")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> buffer(@RequestBody @Valid BufferRequest request) {
        return worker.buffer(request).thenApply(ResponseEntity::ok);
    }

    // 3. Intersección de dos conjuntos (data_a es el CRS de referencia)
    @PostMapping("/intersect")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> intersect(@RequestBody @Valid IntersectRequest request) {
        return worker.intersect(request).thenApply(ResponseEntity::ok);
    }

    // 4. Recorte por máscara
    @PostMapping("/clip")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> clip(@RequestBody @Valid ClipRequest request) {
        return worker.clip(request).thenApply(ResponseEntity::ok);
    }

    // 5. Conversión de formato
    @PostMapping("/convert")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> convert(@RequestBody @Valid ConvertRequest request) {
        return worker.convert(request).thenApply(ResponseEntity::ok);
    }

    // 6. Bounding box
    @PostMapping("/bbox")
    public CompletableFuture<ResponseEntity<BoundingBoxDTO>> bbox(@RequestBody @Valid BboxRequest request) {
        return worker.bbox(request).thenApply(ResponseEntity::ok);
    }

    // 7. Dissolve por atributo
    @PostMapping("/dissolve")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> dissolve(@RequestBody @Valid DissolveRequest request) {
        return worker.dissolve(request).thenApply(ResponseEntity::ok);
    }

    // 8. Explode de geometrías multiparte
    @PostMapping("/explode")
    public CompletableFuture<ResponseEntity<GeodataEnvelope>> explode(@RequestBody @Valid ExplodeRequest request) {
        return worker.explode(request).thenApply(ResponseEntity::ok);
    }
}
