package com.ogt.geodata.codec;

import com.ogt.geodata.crs.CrsRegistry;
import com.ogt.geodata.dto.GeodataEnvelope;
import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.FeatureCollection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Conversión entre {@link GeodataEnvelope} y {@link FeatureCollection}.
 * <p>
 * Tras cargar, la colección nunca está vacía ni contiene geometrías nulas.
 */
@Slf4j
@Service
public class FormatCodec {

    private final Map<GeodataFormat, FormatDriver> drivers = new EnumMap<>(GeodataFormat.class);
    private final CrsRegistry crsRegistry;

    public FormatCodec(List<FormatDriver> drivers, CrsRegistry crsRegistry) {
        for (FormatDriver driver : drivers) {
            this.drivers.put(driver.format(), driver);
        }
        this.crsRegistry = crsRegistry;
    }

    /**
     * Decodifica un payload.
     *
     * @param sourceCrs si se indica, sustituye al CRS declarado por los datos
     */
    public FeatureCollection load(String data, String format, String sourceCrs) {
        GeodataFormat fmt = GeodataFormat.parse(format);
        if (data == null || data.isBlank()) {
            throw GeodataException.missingParameter("data");
        }
        String overrideCrs = crsRegistry.canonicalize(sourceCrs);

        FeatureCollection collection = driverFor(fmt).read(data);
        int total = collection.size();
        collection = collection.withoutNullGeometries();
        if (collection.isEmpty()) {
            throw GeodataException.emptyResult(total == 0
                    ? "Los datos de entrada (" + fmt.id() + ") no contienen ninguna entidad."
                    : "Todas las entidades de entrada (" + total + ") tienen geometría nula.");
        }
        if (collection.size() < total) {
            log.debug("Descartadas {} filas con geometría nula", total - collection.size());
        }

        if (overrideCrs != null) {
            if (collection.hasCrs() && !overrideCrs.equals(collection.getCrs())) {
                log.info("source_crs {} sustituye al CRS declarado {}", overrideCrs, collection.getCrs());
            }
            collection = collection.withCrs(overrideCrs);
        }
        return collection;
    }

    public FeatureCollection load(String data, String format) {
        return load(data, format, null);
    }

    /**
     * Codifica una colección; el formato por defecto es geojson.
     */
    public GeodataEnvelope dump(FeatureCollection collection, String format) {
        GeodataFormat fmt = format == null || format.isBlank() ? GeodataFormat.GEOJSON : GeodataFormat.parse(format);

        FeatureCollection output = collection.withoutNullGeometries();
        if (output.isEmpty()) {
            throw GeodataException.emptyResult("La operación no ha producido ninguna entidad.");
        }
        if (fmt == GeodataFormat.KML && output.hasCrs()) {
            output = crsRegistry.reproject(output, CrsRegistry.WGS84);
        }

        String payload = driverFor(fmt).write(output);
        return GeodataEnvelope.builder()
                .format(fmt.id())
                .encoding(fmt.encoding())
                .crs(output.getCrs())
                .payload(payload)
                .build();
    }

    private FormatDriver driverFor(GeodataFormat format) {
        FormatDriver driver = drivers.get(format);
        if (driver == null) {
            throw GeodataException.unsupportedFormat(format.id());
        }
        return driver;
    }
}
