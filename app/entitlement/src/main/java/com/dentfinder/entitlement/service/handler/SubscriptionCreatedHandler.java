/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: customer.subscription.created でサブスクリプション行を upsert する
 * なぜ: 課金ライフサイクルを店舗ティアとは独立に記録するため
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import com.dentfinder.entitlement.repository.SubscriptionWriter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionCreatedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionCreatedHandler.class);

  private final SubscriptionWriter subscriptionWriter;

  @Override
  public BillingEventType type() {
    return BillingEventType.SUBSCRIPTION_CREATED;
  }

  @Override
  public void handle(BillingEvent event) {
    final Optional<SubscriptionPayload> parsed = SubscriptionPayload.parse(event.dataObject());
    if (parsed.isEmpty()) {
      logger.warn("subscription created without valid subscription id eventId={}", event.id());
      return;
    }
    final SubscriptionPayload payload = parsed.get();
    if (payload.status().isEmpty()) {
      logger.warn(
          "subscription status not tracked subscriptionId={} status={}",
          payload.subscriptionId(),
          payload.providerStatus());
      return;
    }
    final SubscriptionStatus status = payload.status().get();
    if (!payload.hasCompleteMetadata()) {
      // 作成に必要なメタデータがないため、既存行があれば状態だけ合わせる
      final int updated = subscriptionWriter.updateStatus(payload.subscriptionId(), status);
      logger.warn(
          "subscription created with missing or invalid metadata subscriptionId={} statusUpdated={}",
          payload.subscriptionId(),
          updated);
      return;
    }
    subscriptionWriter.upsert(payload.toSnapshot(status));
    logger.info(
        "subscription recorded subscriptionId={} status={}",
        payload.subscriptionId(),
        status.value());
  }
}
