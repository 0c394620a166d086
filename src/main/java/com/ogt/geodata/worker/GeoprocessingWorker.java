package com.ogt.geodata.worker;

import com.ogt.geodata.config.AsyncConfig;
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
import com.ogt.geodata.service.GeometryOperationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Ejecuta las operaciones geométricas en el pool acotado {@code geoprocessingExecutor}.
 * Los errores se devuelven como futuros completados excepcionalmente.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoprocessingWorker {

    private final GeometryOperationService operationService;

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> reproject(ReprojectRequest request) {
        return run("reproject", () -> operationService.reproject(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> buffer(BufferRequest request) {
        return run("buffer", () -> operationService.buffer(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> intersect(IntersectRequest request) {
        return run("intersect", () -> operationService.intersect(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> clip(ClipRequest request) {
        return run("clip", () -> operationService.clip(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> convert(ConvertRequest request) {
        return run("convert", () -> operationService.convert(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<BoundingBoxDTO> bbox(BboxRequest request) {
        return run("bbox", () -> operationService.bbox(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> dissolve(DissolveRequest request) {
        return run("dissolve", () -> operationService.dissolve(request));
    }

    @Async(AsyncConfig.GEOPROCESSING_EXECUTOR)
    public CompletableFuture<GeodataEnvelope> explode(ExplodeRequest request) {
        return run("explode", () -> operationService.explode(request));
    }

    private <T> CompletableFuture<T> run(String operation, Supplier<T> task) {
        long start = System.currentTimeMillis();
        log.info("▶️ {} en {}", operation, Thread.currentThread().getName());
        try {
            T result = task.get();
            log.info("✅ {} completado en {} ms", operation, System.currentTimeMillis() - start);
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            log.warn("❌ {} falló: {}", operation, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
