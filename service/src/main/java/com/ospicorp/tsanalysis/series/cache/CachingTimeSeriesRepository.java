package com.ospicorp.tsanalysis.series.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.tsanalysis.series.model.FrequencyDomainData;
import com.ospicorp.tsanalysis.series.model.TimeDomainData;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.repository.TimeSeriesRepository;
import com.ospicorp.tsanalysis.series.service.TimeSeriesTransformer;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Read-through cache in front of any {@link TimeSeriesRepository}, also serving the derived time-
 * and frequency-domain views.
 *
 * <p>Writes go to the delegate first and evict the entity and both views afterwards. Entries
 * carry a TTL that only bounds staleness when an eviction is lost. Every cache failure is logged
 * and bypassed: an unreachable cache never fails a request.
 */
public class CachingTimeSeriesRepository implements TimeSeriesRepository {
  private static final Logger log = LoggerFactory.getLogger(CachingTimeSeriesRepository.class);

  private final TimeSeriesRepository delegate;
  private final CacheStore cache;
  private final ObjectMapper mapper;
  private final Duration ttl;
  // bumped after every mutation; a fill that overlaps a write is skipped or evicted again
  private final AtomicLong writeEpoch = new AtomicLong();

  public CachingTimeSeriesRepository(TimeSeriesRepository delegate, CacheStore cache,
      ObjectMapper mapper, Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache ttl must be positive");
    }
    this.delegate = delegate;
    this.cache = cache;
    this.mapper = mapper;
    this.ttl = ttl;
  }

  @Override
  public TimeSeries save(TimeSeries series) {
    TimeSeries saved = null;
    try {
      saved = delegate.save(series);
      return saved;
    } finally {
      String id = saved != null ? saved.id() : series.id();
      if (StringUtils.hasText(id)) {
        invalidate(id);
      }
    }
  }

  @Override
  public TimeSeries findById(String id) {
    return cached(CacheKeys.entity(id), TimeSeries.class, () -> delegate.findById(id));
  }

  public TimeDomainData getTimeDomainData(String id) {
    return cached(CacheKeys.timeDomain(id), TimeDomainData.class,
        () -> TimeSeriesTransformer.timeDomain(findById(id)));
  }

  public FrequencyDomainData getFrequencyDomainData(String id) {
    return cached(CacheKeys.frequencyDomain(id), FrequencyDomainData.class,
        () -> TimeSeriesTransformer.frequencyDomain(findById(id)));
  }

  @Override
  public List<TimeSeries> findAll() {
    return delegate.findAll();
  }

  @Override
  public void delete(String id) {
    try {
      delegate.delete(id);
    } finally {
      invalidate(id);
    }
  }

  @Override
  public boolean exists(String id) {
    return delegate.exists(id);
  }

  public void invalidate(String id) {
    writeEpoch.incrementAndGet();
    List<String> keys = CacheKeys.all(id);
    try {
      cache.evict(keys);
      log.debug("Evicted cache keys {}", keys);
    } catch (RuntimeException ex) {
      log.warn("Cache eviction of {} failed; entries expire within {}: {}", keys, ttl,
          ex.getMessage());
    }
  }

  private <T> T cached(String key, Class<T> type, Supplier<T> loader) {
    Optional<T> hit = read(key, type);
    if (hit.isPresent()) {
      log.debug("Cache hit for {}", key);
      return hit.get();
    }
    log.debug("Cache miss for {}", key);
    long epoch = writeEpoch.get();
    T value = loader.get();
    if (epoch != writeEpoch.get()) {
      log.debug("Not caching {}: a write happened while it was loading", key);
      return value;
    }
    write(key, value);
    // a write that invalidated between the check and the put would miss this entry
    if (epoch != writeEpoch.get()) {
      log.debug("Dropping {}: a write raced the cache fill", key);
      evictQuietly(key);
    }
    return value;
  }

  private <T> Optional<T> read(String key, Class<T> type) {
    Optional<String> raw;
    try {
      raw = cache.get(key);
    } catch (RuntimeException ex) {
      log.warn("Cache read of {} failed, falling back to storage: {}", key, ex.getMessage());
      return Optional.empty();
    }
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(raw.get(), type));
    } catch (JsonProcessingException ex) {
      log.warn("Discarding unreadable cache entry {}: {}", key, ex.getOriginalMessage());
      evictQuietly(key);
      return Optional.empty();
    }
  }

  private void evictQuietly(String key) {
    try {
      cache.evict(List.of(key));
    } catch (RuntimeException ex) {
      log.warn("Cache eviction of {} failed; entry expires within {}: {}", key, ttl,
          ex.getMessage());
    }
  }

  private void write(String key, Object value) {
    String serialized;
    try {
      serialized = mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      log.warn("Unable to serialize {} for caching: {}", key, ex.getOriginalMessage());
      return;
    }
    try {
      cache.put(key, serialized, ttl);
    } catch (RuntimeException ex) {
      log.warn("Cache write of {} failed: {}", key, ex.getMessage());
    }
  }
}
