package com.ogt.geodata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "geodata")
public class GeodataProperties {

    private Cache cache = new Cache();
    private Worker worker = new Worker();

    @Data
    public static class Cache {
        private Path rootDir = Path.of(System.getProperty("user.home"), ".geodata_cache");
        private Duration ttl = Duration.ofHours(24);
        private long sweepIntervalMs = 3_600_000L;
    }

    @Data
    public static class Worker {
        private int coreSize = Runtime.getRuntime().availableProcessors();
        private int maxSize = Runtime.getRuntime().availableProcessors();
        private int queueCapacity = 100;
    }
}
