/*
 * どこで: Entitlement サービス層
 * 何を: 公開 CTA イベントの検証、レート制限、保存を行う
 * なぜ: 計測を best-effort に保ちつつ、濫用による書き込みを上限で抑えるため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.common.OriginHasher;
import com.dentfinder.entitlement.api.RateLimitExceededException;
import com.dentfinder.entitlement.api.StoreNotFoundException;
import com.dentfinder.entitlement.config.CtaRateLimitProperties;
import com.dentfinder.entitlement.model.CtaEventType;
import com.dentfinder.entitlement.model.RateLimitScope;
import com.dentfinder.entitlement.repository.CtaEventRepository;
import com.dentfinder.entitlement.repository.StoreRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CtaEventService {

  private static final Logger logger = LoggerFactory.getLogger(CtaEventService.class);

  private final StoreRepository storeRepository;
  private final CtaEventRepository ctaEventRepository;
  private final DurableRateLimiter rateLimiter;
  private final CtaRateLimitProperties rateLimitProperties;
  private final EntitlementMetrics metrics;
  private final Clock clock;

  /**
   * 検証を順に行い、すべて通過したイベントを保存する。
   *
   * @throws IllegalArgumentException event_type が既知の種別でない
   * @throws StoreNotFoundException 店舗が存在しない
   * @throws RateLimitExceededException 送信元単位または店舗単位の上限超過
   */
  public void record(long storeId, String eventType, String sourcePage, String clientIp) {
    final CtaEventType type =
        CtaEventType.fromValue(eventType)
            .orElseThrow(
                () -> {
                  metrics.recordCtaEvent("invalid");
                  return new IllegalArgumentException("event_type is invalid");
                });
    if (!storeExists(storeId)) {
      metrics.recordCtaEvent("not_found");
      throw new StoreNotFoundException(storeId);
    }
    final String originKey = "cta:origin:" + OriginHasher.hash(clientIp) + ":" + storeId;
    if (!rateLimiter.checkAndIncrement(
        originKey, rateLimitProperties.originCeiling(), rateLimitProperties.originWindow())) {
      reject(RateLimitScope.ORIGIN, storeId);
    }
    final String subjectKey = "cta:subject:" + storeId;
    if (!rateLimiter.checkAndIncrement(
        subjectKey, rateLimitProperties.subjectCeiling(), rateLimitProperties.subjectWindow())) {
      reject(RateLimitScope.SUBJECT, storeId);
    }
    try {
      ctaEventRepository.insert(storeId, type, sourcePage, Instant.now(clock));
      metrics.recordCtaEvent("accepted");
    } catch (DataAccessException ex) {
      // 保存失敗は成功として応答する
      metrics.recordCtaEvent("persist_failed");
      logger.warn("cta event persistence failed storeId={} type={}", storeId, type.value(), ex);
    }
  }

  private boolean storeExists(long storeId) {
    try {
      return storeRepository.existsById(storeId);
    } catch (DataAccessException ex) {
      logger.error("store existence check failed storeId={}", storeId, ex);
      return false;
    }
  }

  private void reject(RateLimitScope scope, long storeId) {
    metrics.recordRateLimited(scope);
    metrics.recordCtaEvent("rate_limited");
    throw new RateLimitExceededException(scope);
  }
}
