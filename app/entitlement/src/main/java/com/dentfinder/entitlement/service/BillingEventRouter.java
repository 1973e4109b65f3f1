/*
 * どこで: Entitlement サービス層
 * 何を: 検証済みイベントを台帳確認の上で種別ごとのハンドラへ振り分ける
 * なぜ: ハンドラ実行と処理済み記録を同一トランザクションで確定させるため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.RouteOutcome;
import com.dentfinder.entitlement.repository.ProcessedWebhookEventRepository;
import com.dentfinder.entitlement.service.handler.BillingEventHandler;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BillingEventRouter {

  private static final Logger logger = LoggerFactory.getLogger(BillingEventRouter.class);

  private final Map<BillingEventType, BillingEventHandler> handlers;
  private final ProcessedWebhookEventRepository processedEventRepository;
  private final WebhookEventLockKeyGenerator lockKeyGenerator;
  private final Clock clock;

  public BillingEventRouter(
      List<BillingEventHandler> handlers,
      ProcessedWebhookEventRepository processedEventRepository,
      WebhookEventLockKeyGenerator lockKeyGenerator,
      Clock clock) {
    final Map<BillingEventType, BillingEventHandler> byType = new EnumMap<>(BillingEventType.class);
    for (BillingEventHandler handler : handlers) {
      final BillingEventHandler previous = byType.put(handler.type(), handler);
      if (previous != null) {
        throw new IllegalStateException("duplicate handler for " + handler.type());
      }
    }
    this.handlers = Collections.unmodifiableMap(byType);
    this.processedEventRepository = processedEventRepository;
    this.lockKeyGenerator = lockKeyGenerator;
    this.clock = clock;
  }

  /**
   * イベントを 1 件処理する。
   *
   * <p>ハンドラが例外を投げた場合はトランザクションごと巻き戻り、台帳にも記録しない。
   */
  @Transactional
  public RouteOutcome route(BillingEvent event) {
    // 同一イベント ID の同時配送を直列化してから台帳を確認する
    processedEventRepository.lockByEventId(lockKeyGenerator.generate(event.id()));
    if (processedEventRepository.exists(event.id())) {
      logger.info("webhook event already processed eventId={} type={}", event.id(), event.type());
      return RouteOutcome.DUPLICATE;
    }
    final Optional<BillingEventHandler> handler = event.eventType().map(handlers::get);
    final RouteOutcome outcome;
    if (handler.isPresent()) {
      handler.get().handle(event);
      outcome = RouteOutcome.PROCESSED;
    } else {
      // 未対応の種別も 2xx で受け、プロバイダに再送させない
      logger.info("webhook event type ignored eventId={} type={}", event.id(), event.type());
      outcome = RouteOutcome.IGNORED;
    }
    processedEventRepository.insertIfAbsent(event.id(), event.type(), Instant.now(clock));
    return outcome;
  }
}
