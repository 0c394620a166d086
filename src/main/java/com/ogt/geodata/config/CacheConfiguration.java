package com.ogt.geodata.config;

import com.ogt.geodata.cache.CacheConfig;
import com.ogt.geodata.cache.ResultCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(GeodataProperties properties, Clock clock) {
        GeodataProperties.Cache cache = properties.getCache();
        return new ResultCache(new CacheConfig(cache.getRootDir(), cache.getTtl()), clock);
    }
}
