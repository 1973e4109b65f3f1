/*
 * どこで: Entitlement retention サービス
 * 何を: 処理済みイベント台帳と期限切れレート制限カウンタを削除する
 * なぜ: テーブル肥大化を防ぎ、運用負荷を下げるため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.config.EntitlementRetentionProperties;
import com.dentfinder.entitlement.repository.ProcessedWebhookEventRepository;
import com.dentfinder.entitlement.repository.RateLimitCounterRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EntitlementRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(EntitlementRetentionService.class);

  private final ProcessedWebhookEventRepository processedEventRepository;
  private final RateLimitCounterRepository rateLimitCounterRepository;
  private final EntitlementRetentionProperties retentionProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    // 台帳はプロバイダの再送期間より十分長く残す
    final Instant processedThreshold = now.minus(retentionProperties.processedEventTtl());
    final int deletedEvents = processedEventRepository.deleteProcessedBefore(processedThreshold);
    // カウンタは窓の終了時刻を expires_at に持つため、期限切れのみ削除する
    final int deletedCounters = rateLimitCounterRepository.deleteExpired(now);
    logger.info(
        "entitlement retention cleanup deleted processedEvents={} rateLimitCounters={}"
            + " processedThreshold={}",
        deletedEvents,
        deletedCounters,
        processedThreshold);
  }
}
