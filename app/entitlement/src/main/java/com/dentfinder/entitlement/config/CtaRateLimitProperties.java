/*
 * どこで: Entitlement アプリの設定バインド
 * 何を: CTA レート制限の上限値と窓幅を保持する
 * なぜ: 送信元単位と店舗単位の上限を再デプロイなしで調整するため
 */
package com.dentfinder.entitlement.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "entitlement.cta.rate-limit")
public record CtaRateLimitProperties(
    int originCeiling, Duration originWindow, int subjectCeiling, Duration subjectWindow) {

  public CtaRateLimitProperties {
    originCeiling = originCeiling <= 0 ? 60 : originCeiling;
    originWindow = isPositive(originWindow) ? originWindow : Duration.ofMinutes(1);
    subjectCeiling = subjectCeiling <= 0 ? 1000 : subjectCeiling;
    subjectWindow = isPositive(subjectWindow) ? subjectWindow : Duration.ofHours(1);
  }

  // 窓幅 0 以下は窓の切り捨て計算ができないため既定値に戻す
  private static boolean isPositive(Duration window) {
    return window != null && window.toMillis() > 0;
  }
}
