package com.ogt.geodata.cache;

import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Ubicación y tiempo de vida de un {@link ResultCache}.
 */
@Value
public class CacheConfig {

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    Path rootDir;
    Duration ttl;

    public static CacheConfig of(Path rootDir) {
        return new CacheConfig(rootDir, DEFAULT_TTL);
    }
}
