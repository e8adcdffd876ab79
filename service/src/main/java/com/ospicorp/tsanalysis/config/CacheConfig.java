package com.ospicorp.tsanalysis.config;

import com.ospicorp.tsanalysis.series.cache.CacheStore;
import com.ospicorp.tsanalysis.series.cache.InMemoryCacheStore;
import com.ospicorp.tsanalysis.series.cache.RedisCacheStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CacheConfig {
  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  @Bean
  @ConditionalOnProperty(name = "tsanalysis.cache.store", havingValue = "redis",
      matchIfMissing = true)
  CacheStore redisCacheStore(StringRedisTemplate redisTemplate) {
    log.info("Caching time series in Redis");
    return new RedisCacheStore(redisTemplate);
  }

  @Bean
  @ConditionalOnProperty(name = "tsanalysis.cache.store", havingValue = "memory")
  CacheStore inMemoryCacheStore(Clock clock) {
    log.info("Caching time series in process memory");
    return new InMemoryCacheStore(clock);
  }
}
