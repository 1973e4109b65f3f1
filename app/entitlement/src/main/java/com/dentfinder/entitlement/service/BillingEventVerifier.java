/*
 * どこで: Entitlement サービス層
 * 何を: webhook の署名を検証し、検証済みイベントへ変換する
 * なぜ: 公開エンドポイントの信頼を署名のみで確立するため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.api.InvalidWebhookPayloadException;
import com.dentfinder.entitlement.api.WebhookSignatureException;
import com.dentfinder.entitlement.config.EntitlementWebhookProperties;
import com.dentfinder.entitlement.model.BillingEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BillingEventVerifier {

  private static final Logger logger = LoggerFactory.getLogger(BillingEventVerifier.class);

  private final EntitlementWebhookProperties properties;
  private final ObjectMapper objectMapper;

  /**
   * 署名検証を行ってからペイロードを解釈する。
   *
   * @throws WebhookSignatureException 署名ヘッダの欠落、鍵の未設定、署名不一致、許容時間外
   * @throws InvalidWebhookPayloadException 署名は正しいが id/type を持たない
   */
  public BillingEvent verify(String payload, String signatureHeader) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new WebhookSignatureException("Stripe-Signature header is required");
    }
    if (properties.signingSecret().isBlank()) {
      // 鍵が未設定なら常に拒否する
      logger.error("webhook signing secret is not configured; rejecting callback");
      throw new WebhookSignatureException("webhook signature cannot be verified");
    }
    try {
      Webhook.Signature.verifyHeader(
          payload, signatureHeader, properties.signingSecret(), properties.tolerance().toSeconds());
    } catch (SignatureVerificationException ex) {
      throw new WebhookSignatureException("webhook signature verification failed", ex);
    }
    return decode(payload);
  }

  private BillingEvent decode(String payload) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new InvalidWebhookPayloadException("webhook payload is not valid JSON", ex);
    }
    final String id = root.path("id").asText("");
    final String type = root.path("type").asText("");
    if (id.isBlank() || type.isBlank()) {
      throw new InvalidWebhookPayloadException("webhook payload must contain id and type");
    }
    return new BillingEvent(id, type, root.path("data").path("object"));
  }
}
