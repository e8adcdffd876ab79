package com.ospicorp.tsanalysis.series.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.tsanalysis.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryCacheStoreTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  private final InMemoryCacheStore store = new InMemoryCacheStore(clock);

  @Test
  void returnsValueUntilItExpires() {
    store.put("k", "v", Duration.ofSeconds(30));

    clock.advance(Duration.ofSeconds(29));
    assertThat(store.get("k")).contains("v");

    clock.advance(Duration.ofSeconds(1));
    assertThat(store.get("k")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void evictRemovesOnlyTheGivenKeys() {
    store.put("a", "1", Duration.ofMinutes(1));
    store.put("b", "2", Duration.ofMinutes(1));
    store.put("c", "3", Duration.ofMinutes(1));

    store.evict(List.of("a", "c", "missing"));

    assertThat(store.get("a")).isEmpty();
    assertThat(store.get("b")).contains("2");
    assertThat(store.size()).isEqualTo(1);
  }
}
