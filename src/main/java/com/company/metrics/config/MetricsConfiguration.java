package com.company.metrics.config;

import com.company.metrics.cache.EntryCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine-specific metrics
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder engineMetrics(ObjectProvider<EntryCache> entryCaches) {
        return (registry) -> {
            // Entries held by every cache in the context
            Gauge.builder("metrics.cache.entries", entryCaches, caches -> {
                        try {
                            return caches.stream().mapToInt(EntryCache::size).sum();
                        } catch (RuntimeException e) {
                            log.warn("Failed to count cached entries", e);
                            return 0;
                        }
                    })
                    .description("Number of entries currently held by entry caches")
                    .register(registry);

            log.info("Engine metrics registered");
        };
    }
}
