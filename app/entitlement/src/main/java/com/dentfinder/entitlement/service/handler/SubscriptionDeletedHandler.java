/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: customer.subscription.deleted でサブスクリプションを canceled にする
 * なぜ: 解約後も支払済み期間の掲載を残すため (ティアと期限は消さない)
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
public class SubscriptionDeletedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionDeletedHandler.class);

  private final SubscriptionWriter subscriptionWriter;

  @Override
  public BillingEventType type() {
    return BillingEventType.SUBSCRIPTION_DELETED;
  }

  @Override
  public void handle(BillingEvent event) {
    final Optional<SubscriptionPayload> parsed = SubscriptionPayload.parse(event.dataObject());
    if (parsed.isEmpty()) {
      logger.warn("subscription deleted without valid subscription id eventId={}", event.id());
      return;
    }
    final SubscriptionPayload payload = parsed.get();
    if (payload.hasCompleteMetadata()) {
      // created より先に届いても canceled 行を残し、後続の created で復活させない
      subscriptionWriter.upsert(payload.toSnapshot(SubscriptionStatus.CANCELED));
      logger.info("subscription canceled subscriptionId={}", payload.subscriptionId());
      return;
    }
    final int updated =
        subscriptionWriter.updateStatus(payload.subscriptionId(), SubscriptionStatus.CANCELED);
    if (updated == 0) {
      logger.info(
          "subscription to cancel not found and metadata incomplete subscriptionId={}",
          payload.subscriptionId());
      return;
    }
    logger.info("subscription canceled subscriptionId={}", payload.subscriptionId());
  }
}
