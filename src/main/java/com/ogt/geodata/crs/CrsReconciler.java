package com.ogt.geodata.crs;

import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.FeatureCollection;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Alinea el CRS de dos colecciones antes de una operación binaria.
 * <p>
 * Regla (dependiente del orden):
 * <ol>
 *   <li>con {@code targetCrs}, ambas se reproyectan a él;</li>
 *   <li>si ambas tienen CRS y coinciden, se devuelven intactas;</li>
 *   <li>si ambas tienen CRS distinto, {@code b} se reproyecta al CRS de {@code a};</li>
 *   <li>si alguna no tiene CRS, error {@code INCOMPATIBLE_CRS}.</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrsReconciler {

    private final CrsRegistry crsRegistry;

    public Reconciled reconcile(FeatureCollection a, FeatureCollection b, String targetCrs) {
        String target = crsRegistry.canonicalize(targetCrs);
        if (target != null) {
            return new Reconciled(crsRegistry.reproject(a, target), crsRegistry.reproject(b, target));
        }

        if (a.hasCrs() && b.hasCrs()) {
            if (a.getCrs().equals(b.getCrs())) {
                return new Reconciled(a, b);
            }
            log.info("CRS distintos ({} / {}): se reproyecta el segundo al CRS del primero", a.getCrs(), b.getCrs());
            return new Reconciled(a, crsRegistry.reproject(b, a.getCrs()));
        }

        throw GeodataException.incompatibleCrs(
                "Los CRS de los dos conjuntos de datos son desconocidos o incompatibles. "
                        + "Indique `source_crs` para cada entrada o `target_crs`.");
    }

    /**
     * CRS de trabajo para operaciones métricas: el explícito o, en su defecto, el de la colección.
     */
    public String resolveWorkingCrs(FeatureCollection collection, String explicitCrs) {
        String working = crsRegistry.canonicalize(explicitCrs);
        if (working == null) {
            working = collection.getCrs();
        }
        if (working == null) {
            throw GeodataException.incompatibleCrs(
                    "No se puede determinar un CRS métrico para el buffer. Indique `source_crs` o `buffer_crs`.");
        }
        return working;
    }

    @Value
    public static class Reconciled {
        FeatureCollection primary;
        FeatureCollection secondary;
    }
}
