/*
 * どこで: Entitlement API
 * 何を: 決済プロバイダからの webhook を受け付ける
 * なぜ: 署名検証前の本文を加工せずサービス層へ渡すため
 */
package com.dentfinder.entitlement.api;

import com.dentfinder.entitlement.service.StripeWebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class StripeWebhookController {

    private static final String HEADER_SIGNATURE = "Stripe-Signature";

    private final StripeWebhookService webhookService;

    @PostMapping("/webhooks/stripe")
    public WebhookAckResponse receive(
            // ヘッダ欠落も署名エラーとして扱うため required=false で受ける
            @RequestHeader(value = HEADER_SIGNATURE, required = false) String signature,
            @RequestBody String payload) {
        webhookService.handle(payload, signature);
        return new WebhookAckResponse(true);
    }
}
