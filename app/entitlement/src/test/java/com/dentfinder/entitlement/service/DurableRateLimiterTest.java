/*
 * どこで: DurableRateLimiter の単体テスト
 * 何を: 窓境界の計算、上限判定、障害時の許可を検証する
 * なぜ: 全インスタンスで同じ窓を使い、カウンタ障害で受付を止めないことを保証するため
 */
package com.dentfinder.entitlement.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dentfinder.entitlement.repository.RateLimitCounterRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

class DurableRateLimiterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:17:42.500Z");
  private static final Instant MINUTE_START = Instant.parse("2026-03-01T10:17:00Z");

  private final RateLimitCounterRepository counterRepository = mock(RateLimitCounterRepository.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final DurableRateLimiter limiter =
      new DurableRateLimiter(
          counterRepository, new EntitlementMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void windowStartIsAlignedToEpoch() {
    assertThat(DurableRateLimiter.windowStart(NOW, Duration.ofMinutes(1))).isEqualTo(MINUTE_START);
    assertThat(DurableRateLimiter.windowStart(NOW, Duration.ofHours(1)))
        .isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }

  @Test
  void allowsUpToCeilingInclusive() {
    when(counterRepository.incrementAndGet("k", MINUTE_START, MINUTE_START.plusSeconds(60)))
        .thenReturn(60L, 61L);

    assertThat(limiter.checkAndIncrement("k", 60, Duration.ofMinutes(1))).isTrue();
    assertThat(limiter.checkAndIncrement("k", 60, Duration.ofMinutes(1))).isFalse();
  }

  @Test
  void failsOpenWhenCounterStoreUnavailable() {
    when(counterRepository.incrementAndGet("k", MINUTE_START, MINUTE_START.plusSeconds(60)))
        .thenThrow(new QueryTimeoutException("timeout"));

    assertThat(limiter.checkAndIncrement("k", 60, Duration.ofMinutes(1))).isTrue();
    verify(counterRepository).incrementAndGet("k", MINUTE_START, MINUTE_START.plusSeconds(60));
    assertThat(registry.get("entitlement.cta.rate_limiter.errors.total").counter().count())
        .isEqualTo(1.0d);
  }
}
