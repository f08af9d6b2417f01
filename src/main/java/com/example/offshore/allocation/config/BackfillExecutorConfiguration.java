package com.example.offshore.allocation.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
public class BackfillExecutorConfiguration {

    /**
     * Backfill runs are sequential by design; one worker thread is enough.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService backfillExecutor() {
        log.info("Creating single-thread backfill executor");
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("backfill-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
