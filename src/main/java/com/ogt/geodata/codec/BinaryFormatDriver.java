package com.ogt.geodata.codec;

import com.ogt.geodata.exception.GeodataException;
import com.ogt.geodata.model.FeatureCollection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Base de los drivers binarios: decodifica/codifica base64 y prepara un
 * directorio temporal de trabajo que se borra siempre al terminar.
 */
@Slf4j
public abstract class BinaryFormatDriver implements FormatDriver {

    @Override
    public FeatureCollection read(String payload) {
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(payload.trim());
        } catch (IllegalArgumentException e) {
            throw GeodataException.invalidParameter("El contenido " + format().id() + " no es base64 válido.", e);
        }
        if (bytes.length == 0) {
            throw GeodataException.invalidParameter("El contenido " + format().id() + " está vacío.");
        }

        Path staging = createStagingDir();
        try {
            return readStaged(bytes, staging);
        } catch (IOException e) {
            throw GeodataException.processingFailure("Error leyendo " + format().id() + ": " + e.getMessage(), e);
        } finally {
            cleanup(staging);
        }
    }

    @Override
    public String write(FeatureCollection collection) {
        Path staging = createStagingDir();
        try {
            byte[] bytes = writeStaged(collection, staging);
            return Base64.getEncoder().encodeToString(bytes);
        } catch (IOException e) {
            throw GeodataException.processingFailure("Error escribiendo " + format().id() + ": " + e.getMessage(), e);
        } finally {
            cleanup(staging);
        }
    }

    protected abstract FeatureCollection readStaged(byte[] data, Path staging) throws IOException;

    protected abstract byte[] writeStaged(FeatureCollection collection, Path staging) throws IOException;

    private Path createStagingDir() {
        try {
            return Files.createTempDirectory("geodata_" + format().id() + "_");
        } catch (IOException e) {
            throw GeodataException.processingFailure("No se pudo crear el directorio temporal", e);
        }
    }

    private void cleanup(Path staging) {
        try {
            FileSystemUtils.deleteRecursively(staging);
        } catch (IOException e) {
            log.debug("No se pudo borrar el directorio temporal {}: {}", staging, e.getMessage());
        }
    }
}
