package com.di.suitesplit.config;

import com.di.suitesplit.catalog.CachingDurationCatalog;
import com.di.suitesplit.catalog.DurationCatalog;
import com.di.suitesplit.catalog.InMemoryDurationCatalog;
import com.di.suitesplit.catalog.JsonFileDurationCatalog;
import com.di.suitesplit.multiversion.MultiversionExpander;
import com.di.suitesplit.naming.SubSuiteIdentity;
import com.di.suitesplit.service.SuiteGenerationService;
import com.di.suitesplit.split.GreedyBalanceStrategy;
import com.di.suitesplit.split.RoundRobinStrategy;
import com.di.suitesplit.split.StandardCostReducer;
import com.di.suitesplit.split.SuitePartitioner;
import com.di.suitesplit.task.ResmokeTaskGenerator;
import com.di.suitesplit.task.TaskGenerationOptions;
import com.di.suitesplit.timeout.TimeoutEstimator;
import com.di.suitesplit.util.SplitMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Composition root: every pipeline component is built here with its collaborators passed
 * explicitly, so the core classes carry no container annotations.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ SuiteSplitProperties.class, TimeoutProperties.class,
        TaskGenerationProperties.class, CatalogProperties.class })
public class SuiteSplitConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DurationCatalog durationCatalog(CatalogProperties properties) {
        if (properties.getHistoryFile() == null || properties.getHistoryFile().isBlank()) {
            log.info("[CATALOG] No history file configured; splits fall back to round-robin without request history");
            return InMemoryDurationCatalog.empty();
        }
        DurationCatalog file = new JsonFileDurationCatalog(Path.of(properties.getHistoryFile()));
        if (!properties.getCache().isEnabled()) {
            return file;
        }
        return new CachingDurationCatalog(file, properties.getCache().getMaxSize(),
                properties.getCache().getExpireAfterWriteMinutes());
    }

    @Bean
    public SuitePartitioner suitePartitioner(SuiteSplitProperties properties) {
        return new SuitePartitioner(StandardCostReducer.fromName(properties.getCostReduction()),
                new GreedyBalanceStrategy(), new RoundRobinStrategy());
    }

    @Bean
    public TimeoutEstimator timeoutEstimator(TimeoutProperties properties) {
        return new TimeoutEstimator(properties.toPolicy());
    }

    @Bean
    public SubSuiteIdentity subSuiteIdentity() {
        return new SubSuiteIdentity();
    }

    @Bean
    public TaskGenerationOptions taskGenerationOptions(TaskGenerationProperties properties) {
        return properties.toOptions();
    }

    @Bean
    public ResmokeTaskGenerator resmokeTaskGenerator(TimeoutEstimator timeoutEstimator, SubSuiteIdentity identity,
                                                     TaskGenerationOptions options) {
        return new ResmokeTaskGenerator(timeoutEstimator, identity, options);
    }

    @Bean
    public MultiversionExpander multiversionExpander(ResmokeTaskGenerator taskGenerator, TaskGenerationOptions options) {
        return new MultiversionExpander(taskGenerator, options);
    }

    @Bean
    public SplitMetrics splitMetrics(MeterRegistry meterRegistry) {
        return new SplitMetrics(meterRegistry);
    }

    @Bean
    public SuiteGenerationService suiteGenerationService(SuitePartitioner partitioner,
                                                         ResmokeTaskGenerator taskGenerator,
                                                         MultiversionExpander multiversionExpander,
                                                         DurationCatalog durationCatalog,
                                                         SuiteSplitProperties splitProperties,
                                                         TaskGenerationProperties generationProperties,
                                                         SplitMetrics splitMetrics,
                                                         Clock clock) {
        return new SuiteGenerationService(partitioner, taskGenerator, multiversionExpander, durationCatalog,
                splitProperties, generationProperties, splitMetrics, clock);
    }
}
