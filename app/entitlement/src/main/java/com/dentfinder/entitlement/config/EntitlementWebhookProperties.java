/*
 * どこで: Entitlement アプリの設定バインド
 * 何を: webhook 署名検証の秘密鍵と許容時間差を保持する
 * なぜ: 環境ごとに署名鍵を差し替え、リプレイ許容幅を運用で調整するため
 */
package com.dentfinder.entitlement.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "entitlement.webhook")
public record EntitlementWebhookProperties(String signingSecret, Duration tolerance) {

  public EntitlementWebhookProperties {
    signingSecret = signingSecret == null ? "" : signingSecret;
    tolerance = tolerance == null ? Duration.ofSeconds(300) : tolerance;
  }
}
