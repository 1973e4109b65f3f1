/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: checkout.session.completed で店舗ティアと掲載期限を付与する
 * なぜ: 決済完了時点で掲載を開始するため (サブスクリプション行は扱わない)
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.repository.TierGrantWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CheckoutCompletedHandler implements BillingEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(CheckoutCompletedHandler.class);

  private final TierGrantWriter tierGrantWriter;
  private final Clock clock;

  @Override
  public BillingEventType type() {
    return BillingEventType.CHECKOUT_SESSION_COMPLETED;
  }

  @Override
  public void handle(BillingEvent event) {
    final OptionalLong storeId =
        BillingPayloads.storeId(BillingPayloads.metadata(event.dataObject(), "storeId").orElse(null));
    final Optional<FeaturedTier> tier =
        BillingPayloads.tier(BillingPayloads.metadata(event.dataObject(), "tier").orElse(null));
    if (storeId.isEmpty() || tier.isEmpty()) {
      logger.warn("checkout session missing or invalid storeId/tier metadata eventId={}", event.id());
      return;
    }
    final Instant featuredUntil = tier.get().featuredUntil(Instant.now(clock));
    final int updated = tierGrantWriter.grantTier(storeId.getAsLong(), tier.get(), featuredUntil);
    if (updated == 0) {
      logger.warn(
          "checkout session references unknown store eventId={} storeId={}",
          event.id(),
          storeId.getAsLong());
      return;
    }
    logger.info(
        "store tier granted storeId={} tier={} featuredUntil={}",
        storeId.getAsLong(),
        tier.get().value(),
        featuredUntil);
  }
}
