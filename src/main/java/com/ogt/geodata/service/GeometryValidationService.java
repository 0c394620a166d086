package com.ogt.geodata.service;

import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.Feature;
import com.ogt.geodata.model.FeatureCollection;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnóstico topológico de las entradas cuando el núcleo geométrico falla.
 */
@Service
@Slf4j
public class GeometryValidationService {

    /**
     * Diagnóstico de la primera geometría inválida de una colección.
     *
     * @return mapa con índice, tipo, error y ubicación; vacío si todas son válidas
     */
    public Map<String, Object> firstInvalid(FeatureCollection collection) {
        Map<String, Object> result = new LinkedHashMap<>();
        List<Feature> features = collection.getFeatures();

        for (int i = 0; i < features.size(); i++) {
            Geometry geom = features.get(i).getGeometry();
            if (geom == null) continue;

            IsValidOp validOp = new IsValidOp(geom);
            if (validOp.isValid()) continue;

            TopologyValidationError error = validOp.getValidationError();
            result.put("featureIndex", i);
            result.put("geometryType", geom.getGeometryType());
            result.put("errorType", getErrorTypeName(error.getErrorType()));
            result.put("errorMessage", error.getMessage());
            if (error.getCoordinate() != null) {
                result.put("errorLocation", Map.of(
                        "x", error.getCoordinate().x,
                        "y", error.getCoordinate().y
                ));
            }
            break;
        }
        return result;
    }

    /**
     * Convierte un fallo del núcleo geométrico en PROCESSING_FAILURE con el
     * diagnóstico de la primera entrada inválida.
     */
    public GeodataException processingFailure(String operation, RuntimeException cause, FeatureCollection... inputs) {
        StringBuilder message = new StringBuilder("Fallo geométrico en ").append(operation).append(": ")
                .append(cause.getMessage());

        for (int n = 0; n < inputs.length; n++) {
            Map<String, Object> diagnostic = firstInvalid(inputs[n]);
            if (diagnostic.isEmpty()) continue;

            message.append(". Entrada ").append(n + 1).append(", entidad ").append(diagnostic.get("featureIndex"))
                    .append(" (").append(diagnostic.get("geometryType")).append("): ")
                    .append(diagnostic.get("errorType"));
            Object location = diagnostic.get("errorLocation");
            if (location instanceof Map<?, ?> xy) {
                message.append(" en (").append(xy.get("x")).append(", ").append(xy.get("y")).append(')');
            }
            break;
        }

        log.error("❌ {}", message, cause);
        return GeodataException.processingFailure(message.toString(), cause);
    }

    /**
     * Convierte el código numérico de error de JTS a un nombre legible.
     */
    private String getErrorTypeName(int errorType) {
        return switch (errorType) {
            case TopologyValidationError.ERROR -> "GENERIC_ERROR";
            case TopologyValidationError.REPEATED_POINT -> "REPEATED_POINT";
            case TopologyValidationError.HOLE_OUTSIDE_SHELL -> "HOLE_OUTSIDE_SHELL";
            case TopologyValidationError.NESTED_HOLES -> "NESTED_HOLES";
            case TopologyValidationError.DISCONNECTED_INTERIOR -> "DISCONNECTED_INTERIOR";
            case TopologyValidationError.SELF_INTERSECTION -> "SELF_INTERSECTION";
            case TopologyValidationError.RING_SELF_INTERSECTION -> "RING_SELF_INTERSECTION";
            case TopologyValidationError.NESTED_SHELLS -> "NESTED_SHELLS";
            case TopologyValidationError.DUPLICATE_RINGS -> "DUPLICATE_RINGS";
            case TopologyValidationError.TOO_FEW_POINTS -> "TOO_FEW_POINTS";
            case TopologyValidationError.INVALID_COORDINATE -> "INVALID_COORDINATE";
            case TopologyValidationError.RING_NOT_CLOSED -> "RING_NOT_CLOSED";
            default -> "UNKNOWN_ERROR_" + errorType;
        };
    }
}
