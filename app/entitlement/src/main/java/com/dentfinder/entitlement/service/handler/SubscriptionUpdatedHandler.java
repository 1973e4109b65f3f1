/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: customer.subscription.updated でサブスクリプション行を更新し、更新成功時に掲載期限を延ばす
 * なぜ: 継続課金の更新を掲載期間へ反映するため (ティア自体は変更しない)
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import com.dentfinder.entitlement.repository.FeatureWindowWriter;
import com.dentfinder.entitlement.repository.SubscriptionWriter;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionUpdatedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionUpdatedHandler.class);

  private final SubscriptionWriter subscriptionWriter;
  private final FeatureWindowWriter featureWindowWriter;

  @Override
  public BillingEventType type() {
    return BillingEventType.SUBSCRIPTION_UPDATED;
  }

  @Override
  public void handle(BillingEvent event) {
    final Optional<SubscriptionPayload> parsed = SubscriptionPayload.parse(event.dataObject());
    if (parsed.isEmpty()) {
      logger.warn("subscription updated without valid subscription id eventId={}", event.id());
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
      final int updated = subscriptionWriter.updateStatus(payload.subscriptionId(), status);
      logger.info(
          "subscription status updated without metadata subscriptionId={} status={} rows={}",
          payload.subscriptionId(),
          status.value(),
          updated);
      return;
    }
    final int applied = subscriptionWriter.upsert(payload.toSnapshot(status));
    if (applied == 0) {
      logger.info(
          "subscription already canceled; update ignored subscriptionId={}",
          payload.subscriptionId());
      return;
    }
    if (status != SubscriptionStatus.ACTIVE) {
      return;
    }
    if (payload.currentPeriodEnd().isEmpty()) {
      logger.warn(
          "active subscription without current_period_end subscriptionId={}",
          payload.subscriptionId());
      return;
    }
    // 旧期限が切れていても新しい期間終了日まで延ばす
    final long storeId = payload.storeId().getAsLong();
    final Instant periodEnd = payload.currentPeriodEnd().get();
    featureWindowWriter.extendFeatureWindow(storeId, periodEnd);
    logger.info(
        "feature window extended storeId={} subscriptionId={} featuredUntil={}",
        storeId,
        payload.subscriptionId(),
        periodEnd);
  }
}
