package com.ogt.geodata.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Barrido periódico de entradas expiradas, aunque no haya nuevas escrituras.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheSweeper {

    private final ResultCache resultCache;

    @Scheduled(fixedDelayString = "${geodata.cache.sweep-interval-ms:3600000}",
            initialDelayString = "${geodata.cache.sweep-interval-ms:3600000}")
    public void sweep() {
        int deleted = resultCache.sweepExpired();
        log.debug("Barrido programado de caché: {} ficheros eliminados", deleted);
    }
}
