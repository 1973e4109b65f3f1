/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: invoice.payment_failed で関連サブスクリプションを past_due にする
 * なぜ: 支払い失敗を課金状態に反映するため (掲載には触れない)
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import com.dentfinder.entitlement.repository.SubscriptionWriter;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PaymentFailedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(PaymentFailedHandler.class);

  private final SubscriptionWriter subscriptionWriter;

  @Override
  public BillingEventType type() {
    return BillingEventType.INVOICE_PAYMENT_FAILED;
  }

  @Override
  public void handle(BillingEvent event) {
    final Optional<String> subscriptionId = resolveSubscriptionId(event.dataObject());
    if (subscriptionId.isEmpty()) {
      // 単発請求など、サブスクリプションに紐づかない請求書
      logger.info("payment failed without subscription id eventId={}", event.id());
      return;
    }
    final int updated =
        subscriptionWriter.updateStatus(subscriptionId.get(), SubscriptionStatus.PAST_DUE);
    logger.info(
        "subscription marked past_due subscriptionId={} rows={}", subscriptionId.get(), updated);
  }

  // 新しい API バージョンでは parent.subscription_details 側に入る
  private Optional<String> resolveSubscriptionId(JsonNode invoice) {
    final Optional<String> direct = BillingPayloads.providerId(invoice, "subscription");
    if (direct.isPresent()) {
      return direct;
    }
    return BillingPayloads.providerId(
        invoice.path("parent").path("subscription_details"), "subscription");
  }
}
