package com.ogt.geodata.codec;

import com.ogt.geodata.model.FeatureCollection;

/**
 * Lectura/escritura de una codificación concreta. El payload es texto UTF-8
 * para los formatos de texto y base64 para los binarios.
 */
public interface FormatDriver {

    GeodataFormat format();

    FeatureCollection read(String payload);

    String write(FeatureCollection collection);
}
