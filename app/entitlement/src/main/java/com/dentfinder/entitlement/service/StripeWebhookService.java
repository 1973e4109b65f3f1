/*
 * どこで: Entitlement サービス層
 * 何を: webhook 受信から検証、振り分け、結果の記録までをまとめる
 * なぜ: トランザクション外で失敗を捕捉し、再送要求 (5xx) へ確実に変換するため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.api.InvalidWebhookPayloadException;
import com.dentfinder.entitlement.api.WebhookProcessingException;
import com.dentfinder.entitlement.api.WebhookSignatureException;
import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.dentfinder.entitlement.model.RouteOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StripeWebhookService {

  private static final Logger logger = LoggerFactory.getLogger(StripeWebhookService.class);
  private static final String MDC_EVENT_ID = "stripe_event_id";
  private static final String TYPE_UNVERIFIED = "unverified";
  private static final String TYPE_OTHER = "other";

  private final BillingEventVerifier verifier;
  private final BillingEventRouter router;
  private final EntitlementMetrics metrics;

  public RouteOutcome handle(String payload, String signatureHeader) {
    final BillingEvent event;
    try {
      event = verifier.verify(payload, signatureHeader);
    } catch (WebhookSignatureException | InvalidWebhookPayloadException ex) {
      metrics.recordWebhookEvent(TYPE_UNVERIFIED, "rejected");
      throw ex;
    }
    final String typeTag = event.eventType().map(BillingEventType::wireName).orElse(TYPE_OTHER);
    MDC.put(MDC_EVENT_ID, event.id());
    try {
      final RouteOutcome outcome = router.route(event);
      metrics.recordWebhookEvent(typeTag, outcome.value());
      logger.info(
          "webhook event handled eventId={} type={} outcome={}",
          event.id(),
          event.type(),
          outcome.value());
      return outcome;
    } catch (RuntimeException ex) {
      metrics.recordWebhookEvent(typeTag, "failed");
      logger.error("webhook handler failed eventId={} type={}", event.id(), event.type(), ex);
      throw new WebhookProcessingException("Webhook handler failed", ex);
    } finally {
      MDC.remove(MDC_EVENT_ID);
    }
  }
}
