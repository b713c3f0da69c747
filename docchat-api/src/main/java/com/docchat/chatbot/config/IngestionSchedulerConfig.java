package com.docchat.chatbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class IngestionSchedulerConfig {

    /**
     * Worker pool for document ingestion, kept apart from the query path so uploads cannot starve chat.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler ingestionScheduler(@Value("${docchat.ingest.concurrency:4}") int concurrency,
                                        @Value("${docchat.ingest.queue-capacity:1000}") int queueCapacity) {
        return Schedulers.newBoundedElastic(Math.max(1, concurrency), Math.max(1, queueCapacity), "ingest");
    }
}
