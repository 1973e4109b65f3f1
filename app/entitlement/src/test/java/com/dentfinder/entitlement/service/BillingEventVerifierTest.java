/*
 * どこで: BillingEventVerifier の単体テスト
 * 何を: 署名ヘッダの欠落/不一致/期限切れ/鍵未設定での拒否と、正しい署名での解釈を検証する
 * なぜ: 公開エンドポイントが署名以外で信頼を与えないことを保証するため
 */
package com.dentfinder.entitlement.service;

import static com.dentfinder.entitlement.StripeTestEvents.SECRET;
import static com.dentfinder.entitlement.StripeTestEvents.eventJson;
import static com.dentfinder.entitlement.StripeTestEvents.signatureHeader;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dentfinder.entitlement.api.InvalidWebhookPayloadException;
import com.dentfinder.entitlement.api.WebhookSignatureException;
import com.dentfinder.entitlement.config.EntitlementWebhookProperties;
import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class BillingEventVerifierTest {

  private static final String PAYLOAD =
      eventJson("evt_1", "invoice.payment_failed", "{\"id\":\"in_1\",\"subscription\":\"sub_1\"}");

  private final BillingEventVerifier verifier =
      new BillingEventVerifier(
          new EntitlementWebhookProperties(SECRET, Duration.ofSeconds(300)), new ObjectMapper());

  @Test
  void verifiesAndDecodesSignedPayload() {
    final BillingEvent event = verifier.verify(PAYLOAD, signatureHeader(PAYLOAD));

    assertThat(event.id()).isEqualTo("evt_1");
    assertThat(event.eventType()).contains(BillingEventType.INVOICE_PAYMENT_FAILED);
    assertThat(event.dataObject().path("subscription").asText()).isEqualTo("sub_1");
  }

  @Test
  void rejectsMissingSignatureHeader() {
    assertThatThrownBy(() -> verifier.verify(PAYLOAD, null))
        .isInstanceOf(WebhookSignatureException.class)
        .hasMessage("Stripe-Signature header is required");
    assertThatThrownBy(() -> verifier.verify(PAYLOAD, " "))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsSignatureFromAnotherSecret() {
    final String header = signatureHeader(PAYLOAD, "whsec_other", Instant.now());

    assertThatThrownBy(() -> verifier.verify(PAYLOAD, header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsTamperedPayload() {
    final String header = signatureHeader(PAYLOAD);
    final String tampered = PAYLOAD.replace("sub_1", "sub_2");

    assertThatThrownBy(() -> verifier.verify(tampered, header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsTimestampOutsideTolerance() {
    final String header =
        signatureHeader(PAYLOAD, SECRET, Instant.now().minus(Duration.ofMinutes(10)));

    assertThatThrownBy(() -> verifier.verify(PAYLOAD, header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsWhenSecretIsNotConfigured() {
    final BillingEventVerifier unconfigured =
        new BillingEventVerifier(
            new EntitlementWebhookProperties("", Duration.ofSeconds(300)), new ObjectMapper());

    final String header = signatureHeader(PAYLOAD, "whsec_any", Instant.now());

    assertThatThrownBy(() -> unconfigured.verify(PAYLOAD, header))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void rejectsSignedPayloadWithoutEventId() {
    final String payload = "{\"type\":\"invoice.payment_failed\",\"data\":{\"object\":{}}}";

    assertThatThrownBy(() -> verifier.verify(payload, signatureHeader(payload)))
        .isInstanceOf(InvalidWebhookPayloadException.class);
  }
}
