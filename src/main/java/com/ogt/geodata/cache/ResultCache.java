package com.ogt.geodata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ogt.geodata.dto.CacheExportResultDTO;
import com.ogt.geodata.dto.CachedResultDTO;
import com.ogt.geodata.exception.GeodataException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Almacén local de resultados voluminosos.
 * <p>
 * Cada entrada son dos ficheros bajo {@code rootDir}: {@code <cache_id>.json}
 * (resultado completo) y {@code <cache_id>_meta.json} (metadatos + resumen).
 * Cada fichero se escribe en un temporal y se renombra de forma atómica; no hay
 * transacción entre los dos. Las carreras con el barrido de expirados se
 * registran en debug y no se propagan.
 */
@Slf4j
public class ResultCache {

    static final String DATA_SUFFIX = ".json";
    static final String META_SUFFIX = "_meta.json";
    static final int FEATURES_THRESHOLD = 50;
    static final long SIZE_THRESHOLD_BYTES = 10 * 1024;

    @Getter
    private final CacheConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<OperationKind, ResultSummarizer> summarizers = new EnumMap<>(OperationKind.class);

    public ResultCache(CacheConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();

        register(new RouteSummarizer());
        register(new IsochroneSummarizer());
        register(new FeatureCollectionSummarizer(mapper));
        register(new ElevationProfileSummarizer());
        register(new GenericSummarizer(mapper));

        try {
            Files.createDirectories(config.getRootDir());
        } catch (IOException e) {
            throw new IllegalStateException("No se pudo crear el directorio de caché " + config.getRootDir(), e);
        }
        log.info("📦 Caché de resultados en {} (TTL {})", config.getRootDir(), config.getTtl());
    }

    private void register(ResultSummarizer summarizer) {
        summarizers.put(summarizer.kind(), summarizer);
    }

    // ============================================================
    // DECISIÓN
    // ============================================================

    /**
     * Un resultado se cachea si su familia produce secuencias largas, si tiene más
     * de 50 features o si su JSON ocupa más de 10 KiB.
     */
    public boolean shouldCache(Object result, String toolName) {
        if (OperationKind.fromToolName(toolName).isAlwaysCached()) {
            return true;
        }
        if (ResultSummarizer.asList(ResultSummarizer.asMap(result).get("features")).size() > FEATURES_THRESHOLD) {
            return true;
        }
        return GenericSummarizer.serializedSize(mapper, result) > SIZE_THRESHOLD_BYTES;
    }

    /**
     * Devuelve los metadatos de caché si el resultado debe cachearse, o el propio resultado en otro caso.
     */
    public Object respond(Object result, String toolName, Map<String, Object> params) {
        requireSafeToolName(toolName);
        return shouldCache(result, toolName) ? put(result, toolName, params) : result;
    }

    // ============================================================
    // ESCRITURA
    // ============================================================
    public CachedResultDTO put(Object result, String toolName, Map<String, Object> params) {
        requireSafeToolName(toolName);
        sweepExpired();

        Map<String, Object> safeParams = params == null ? Map.of() : params;
        OperationKind kind = OperationKind.fromToolName(toolName);
        String cacheId = generateCacheId(toolName, safeParams);
        Instant createdAt = clock.instant();
        Path dataPath = requireInsideRoot(dataPath(cacheId));
        Path metaPath = requireInsideRoot(metaPath(cacheId));

        // resumen antes de escribir nada en disco
        Map<String, Object> summary = summarizers.get(kind).summarize(result, safeParams);

        try {
            writeAtomically(dataPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result));
            long size = Files.size(dataPath);

            CacheEntry entry = CacheEntry.builder()
                    .cacheId(cacheId)
                    .toolName(toolName)
                    .params(safeParams)
                    .createdAt(createdAt)
                    .expiresAt(createdAt.plus(config.getTtl()))
                    .filePath(dataPath.toAbsolutePath().toString())
                    .fileSizeBytes(size)
                    .summary(summary)
                    .build();
            writeAtomically(metaPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entry));

            log.info("💾 Resultado {} cacheado como {} ({} bytes, {})", toolName, cacheId, size, kind);
            return CachedResultDTO.builder()
                    .cacheId(cacheId)
                    .filePath(entry.getFilePath())
                    .fileSizeKb(Math.round(size / 1024.0 * 100) / 100.0)
                    .expiresAt(entry.getExpiresAt())
                    .summary(entry.getSummary())
                    .usage("Para reutilizar estos datos: GET /api/geodata/cache/" + cacheId
                            + " (metadatos), /geometry (muestra) o POST /export (fichero completo).")
                    .build();
        } catch (IOException e) {
            // sin metadatos no hay entrada
            deleteQuietly(dataPath);
            throw GeodataException.processingFailure("No se pudo escribir la entrada de caché " + cacheId, e);
        }
    }

    private static void requireSafeToolName(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            throw GeodataException.missingParameter("tool_name");
        }
        if (!isSafeId(toolName)) {
            throw GeodataException.invalidParameter(
                    "tool_name no válido: " + toolName + ". Solo se admiten letras, dígitos, '_', '-' y '.'.");
        }
    }

    private Path requireInsideRoot(Path path) {
        Path root = config.getRootDir().toAbsolutePath().normalize();
        Path resolved = path.toAbsolutePath().normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw GeodataException.invalidParameter("Ruta de caché fuera de " + root + ": " + path);
        }
        return resolved;
    }

    String generateCacheId(String toolName, Map<String, Object> params) {
        String sortedParams;
        try {
            sortedParams = mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw GeodataException.invalidParameter("Parámetros no serializables: " + e.getOriginalMessage(), e);
        }
        String hash = DigestUtils.md5DigestAsHex(sortedParams.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
        return toolName + "_" + clock.millis() + "_" + hash;
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(config.getRootDir(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // ============================================================
    // LECTURA
    // ============================================================

    /**
     * Metadatos y resumen de una entrada (nunca el resultado completo).
     *
     * @return {@code null} si no existe o ha expirado (en cuyo caso se borra)
     */
    public CacheEntry get(String cacheId) {
        if (!isSafeId(cacheId)) {
            return null;
        }
        CacheEntry entry = readMeta(metaPath(cacheId));
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            log.debug("Entrada {} expirada, se elimina", cacheId);
            deleteQuietly(dataPath(cacheId));
            deleteQuietly(metaPath(cacheId));
            return null;
        }
        return entry;
    }

    /** Entradas vigentes, de la más reciente a la más antigua. */
    public List<CacheEntry> list() {
        List<CacheEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.getRootDir(), "*" + META_SUFFIX)) {
            for (Path meta : stream) {
                CacheEntry entry = readMeta(meta);
                if (entry != null && !isExpired(entry)) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            log.warn("No se pudo listar la caché {}: {}", config.getRootDir(), e.getMessage());
        }
        entries.sort(Comparator.comparing(CacheEntry::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return entries;
    }

    /**
     * Solo la geometría del resultado almacenado: {@code {type, coordinates, bbox}}.
     * Uso interno (muestreo); nunca se devuelve tal cual al cliente.
     */
    public Map<String, Object> loadGeometry(String cacheId) {
        if (get(cacheId) == null) {
            return null;
        }
        Map<String, Object> data;
        try {
            data = mapper.readValue(dataPath(cacheId).toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            log.debug("Datos de {} no legibles: {}", cacheId, e.getMessage());
            return null;
        }
        Map<String, Object> geometry = ResultSummarizer.asMap(data.get("geometry"));
        if (geometry.isEmpty()) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", geometry.get("type"));
        out.put("coordinates", geometry.get("coordinates"));
        out.put("bbox", data.get("bbox"));
        return out;
    }

    // ============================================================
    // EXPORTACIÓN Y LIMPIEZA
    // ============================================================
    public CacheExportResultDTO export(String cacheId, String destination) {
        if (get(cacheId) == null) {
            throw GeodataException.notFound(cacheId);
        }
        if (destination == null || destination.isBlank()) {
            throw GeodataException.missingParameter("output_path");
        }
        Path target = expandHome(destination).toAbsolutePath().normalize();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.copy(dataPath(cacheId), target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            long size = Files.size(target);
            log.info("📤 Entrada {} exportada a {}", cacheId, target);
            return CacheExportResultDTO.builder()
                    .success(true)
                    .cacheId(cacheId)
                    .outputPath(target.toString())
                    .fileSizeBytes(size)
                    .message("Datos exportados a " + target)
                    .build();
        } catch (NoSuchFileException e) {
            throw GeodataException.notFound(cacheId);
        } catch (IOException e) {
            throw GeodataException.processingFailure("No se pudo exportar " + cacheId + " a " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Borra los ficheros cuya fecha de modificación supera el TTL.
     *
     * @return número de ficheros borrados
     */
    public int sweepExpired() {
        Instant threshold = clock.instant().minus(config.getTtl());
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.getRootDir(), "*" + DATA_SUFFIX)) {
            for (Path file : stream) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(threshold) && Files.deleteIfExists(file)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    log.debug("Fichero {} no eliminado durante el barrido: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("Barrido de caché omitido: {}", e.getMessage());
        }
        if (deleted > 0) {
            log.info("🧹 Barrido de caché: {} ficheros expirados eliminados", deleted);
        }
        return deleted;
    }

    /** Borra todas las entradas. */
    public int clear() {
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.getRootDir(), "*" + DATA_SUFFIX)) {
            for (Path file : stream) {
                if (deleteQuietly(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.debug("Limpieza de caché incompleta: {}", e.getMessage());
        }
        log.info("🗑️ Caché vaciada: {} ficheros", deleted);
        return deleted;
    }

    // ============================================================
    // HELPERS
    // ============================================================
    private CacheEntry readMeta(Path meta) {
        if (!Files.exists(meta)) {
            return null;
        }
        try {
            return mapper.readValue(meta.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.debug("Metadatos {} no legibles: {}", meta.getFileName(), e.getMessage());
            return null;
        }
    }

    private boolean isExpired(CacheEntry entry) {
        return entry.getExpiresAt() == null || clock.instant().isAfter(entry.getExpiresAt());
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("No se pudo borrar {}: {}", file, e.getMessage());
            return false;
        }
    }

    // los identificadores no pueden salir del directorio raíz
    private static boolean isSafeId(String cacheId) {
        return cacheId != null && !cacheId.isBlank() && cacheId.matches("[A-Za-z0-9_.-]+") && !cacheId.contains("..");
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    Path dataPath(String cacheId) {
        return config.getRootDir().resolve(cacheId + DATA_SUFFIX);
    }

    Path metaPath(String cacheId) {
        return config.getRootDir().resolve(cacheId + META_SUFFIX);
    }
}
