/*
 * どこで: Entitlement サービス層
 * 何を: DB 上のカウンタで固定窓のレート制限を判定する
 * なぜ: 再起動や複数インスタンスでも同じ上限を共有するため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.repository.RateLimitCounterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DurableRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(DurableRateLimiter.class);

  private final RateLimitCounterRepository counterRepository;
  private final EntitlementMetrics metrics;
  private final Clock clock;

  /**
   * カウンタを 1 加算し、加算後の値が上限以内かを返す。
   *
   * <p>カウンタ保存先の障害時は可用性を優先して許可する。
   */
  public boolean checkAndIncrement(String counterKey, int ceiling, Duration window) {
    final Instant windowStart = windowStart(Instant.now(clock), window);
    try {
      final long count =
          counterRepository.incrementAndGet(counterKey, windowStart, windowStart.plus(window));
      return count <= ceiling;
    } catch (DataAccessException ex) {
      metrics.recordRateLimiterError();
      logger.warn("rate limit counter unavailable; allowing request counterKey={}", counterKey, ex);
      return true;
    }
  }

  // エポック基準で窓幅に切り捨て、全インスタンスで同じ窓境界を使う
  static Instant windowStart(Instant now, Duration window) {
    final long windowMillis = window.toMillis();
    final long epochMillis = now.toEpochMilli();
    return Instant.ofEpochMilli(epochMillis - Math.floorMod(epochMillis, windowMillis));
  }
}
