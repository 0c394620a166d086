package com.ogt.geodata.worker;

import com.ogt.geodata.dto.ClipRequest;
import com.ogt.geodata.dto.DissolveRequest;
import com.ogt.geodata.dto.GeodataEnvelope;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.service.GeometryOperationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeoprocessingWorkerTest {

    @Mock
    private GeometryOperationService operationService;

    @InjectMocks
    private GeoprocessingWorker worker;

    @Test
    void successfulOperationCompletesTheFuture() throws Exception {
        ClipRequest request = ClipRequest.builder().data("x").inputFormat("geojson").build();
        GeodataEnvelope envelope = GeodataEnvelope.builder().format("geojson").encoding("utf8").payload("{}").build();
        when(operationService.clip(request)).thenReturn(envelope);

        CompletableFuture<GeodataEnvelope> future = worker.clip(request);

        assertThat(future.get()).isSameAs(envelope);
    }

    @Test
    void failuresAreReturnedAsExceptionalFutures() {
        DissolveRequest request = DissolveRequest.builder().data("x").inputFormat("geojson").by("g").build();
        GeodataException failure = GeodataException.invalidParameter("by inexistente");
        when(operationService.dissolve(request)).thenThrow(failure);

        CompletableFuture<GeodataEnvelope> future = worker.dissolve(request);

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::get).isInstanceOf(ExecutionException.class).hasCause(failure);
    }
}
