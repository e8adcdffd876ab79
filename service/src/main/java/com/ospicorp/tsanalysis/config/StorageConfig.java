package com.ospicorp.tsanalysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.tsanalysis.series.StorageException;
import com.ospicorp.tsanalysis.series.cache.CacheStore;
import com.ospicorp.tsanalysis.series.cache.CachingTimeSeriesRepository;
import com.ospicorp.tsanalysis.series.repository.DataPointDao;
import com.ospicorp.tsanalysis.series.repository.DatabaseTimeSeriesRepository;
import com.ospicorp.tsanalysis.series.repository.FileTimeSeriesRepository;
import com.ospicorp.tsanalysis.series.repository.TimeSeriesMetadataRepository;
import com.ospicorp.tsanalysis.series.repository.TimeSeriesRepository;
import com.ospicorp.tsanalysis.series.service.TimeSeriesExporter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class StorageConfig {
  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  Retry storageRetry(
      @Value("${tsanalysis.storage.retry.max-attempts:3}") int maxAttempts,
      @Value("${tsanalysis.storage.retry.wait-ms:200}") long waitMs) {
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .waitDuration(Duration.ofMillis(waitMs))
        .retryOnException(ex -> ex instanceof StorageException storage
            && storage.isTransientFailure())
        .build();
    Retry retry = Retry.of("storage", config);
    retry.getEventPublisher().onRetry(event -> log.warn("Retrying storage call (attempt {}): {}",
        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    return retry;
  }

  @Bean
  @ConditionalOnProperty(name = "tsanalysis.repository.backend", havingValue = "database",
      matchIfMissing = true)
  DataPointDao dataPointDao(JdbcTemplate jdbcTemplate) {
    return new DataPointDao(jdbcTemplate);
  }

  @Bean
  @ConditionalOnProperty(name = "tsanalysis.repository.backend", havingValue = "database",
      matchIfMissing = true)
  TimeSeriesRepository databaseTimeSeriesRepository(TimeSeriesMetadataRepository metadataRepository,
      DataPointDao dataPointDao, PlatformTransactionManager transactionManager,
      Retry storageRetry, Clock clock) {
    log.info("Using database time series repository");
    return new DatabaseTimeSeriesRepository(metadataRepository, dataPointDao, transactionManager,
        storageRetry, clock);
  }

  @Bean
  @ConditionalOnProperty(name = "tsanalysis.repository.backend", havingValue = "file")
  TimeSeriesRepository fileTimeSeriesRepository(ObjectMapper mapper,
      @Value("${tsanalysis.repository.file.path:data/time_series.json}") Path path,
      Clock clock) {
    log.info("Using file time series repository at {}", path.toAbsolutePath());
    return new FileTimeSeriesRepository(path, mapper, clock);
  }

  @Bean
  @Primary
  CachingTimeSeriesRepository cachingTimeSeriesRepository(TimeSeriesRepository delegate,
      CacheStore cacheStore, ObjectMapper mapper,
      @Value("${tsanalysis.cache.ttl:PT1H}") Duration ttl) {
    return new CachingTimeSeriesRepository(delegate, cacheStore, mapper, ttl);
  }

  @Bean
  TimeSeriesExporter timeSeriesExporter(ObjectMapper mapper) {
    return new TimeSeriesExporter(mapper);
  }
}
