package com.vidnyan.cleanup.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.cleanup.adapter.out.store.JdbcFindingStoreFactory;
import com.vidnyan.cleanup.analyzer.Analyzer;
import com.vidnyan.cleanup.application.port.out.AnalysisListener;
import com.vidnyan.cleanup.application.port.out.FindingStoreFactory;
import com.vidnyan.cleanup.application.service.Coordinator;
import com.vidnyan.cleanup.application.service.StoreTopology;
import com.vidnyan.cleanup.domain.finding.Category;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Spring configuration for the cleanup agents.
 * Configuration is read once here and handed to the coordinator as explicit values.
 */
@Slf4j
@Configuration
public class CleanupConfiguration {

    /**
     * ObjectMapper for JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public FindingStoreFactory findingStoreFactory(CleanupProperties properties) {
        CleanupProperties.Store store = properties.getStore();
        return new JdbcFindingStoreFactory(store.getUsername(), store.getPassword(),
                store.getConnectionTimeout(), store.getMaxPoolSize());
    }

    /**
     * Fails startup with a ConfigurationException when no primary store is configured.
     */
    @Bean(destroyMethod = "close")
    public StoreTopology storeTopology(CleanupProperties properties, FindingStoreFactory findingStoreFactory) {
        return StoreTopology.from(properties.getStore().toSettings(), findingStoreFactory);
    }

    /**
     * Workers for forked runs, one per category. Shared by concurrent submissions
     * and shut down with the context.
     */
    @Bean
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Category.values().length);
        executor.setMaxPoolSize(Category.values().length);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public Coordinator coordinator(StoreTopology storeTopology, List<Analyzer> analyzers,
                                   CleanupProperties properties, AnalysisListener analysisListener,
                                   ThreadPoolTaskExecutor analysisExecutor) {
        log.info("Registered {} analyzers:", analyzers.size());
        analyzers.forEach(a -> log.info("  - {} ({})", a.getName(), a.category().key()));
        log.info("Failure policy: {}", properties.getFailurePolicy());
        return new Coordinator(storeTopology, analyzers, properties.getFailurePolicy(),
                analysisListener, analysisExecutor);
    }
}
