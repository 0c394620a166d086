package com.ogt.geodata.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class AsyncConfig {

    public static final String GEOPROCESSING_EXECUTOR = "geoprocessingExecutor";

    // ========== POOL ACOTADO PARA OPERACIONES GEOMÉTRICAS ==========
    @Bean(name = GEOPROCESSING_EXECUTOR)
    public ThreadPoolTaskExecutor geoprocessingExecutor(GeodataProperties properties) {
        GeodataProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getCoreSize());
        executor.setMaxPoolSize(Math.max(worker.getCoreSize(), worker.getMaxSize()));
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix("geoproc-");
        // cola llena: se rechaza la tarea
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        log.info("⚙️ Pool de geoprocesamiento: core={}, max={}, cola={}",
                worker.getCoreSize(), executor.getMaxPoolSize(), worker.getQueueCapacity());
        return executor;
    }
}
