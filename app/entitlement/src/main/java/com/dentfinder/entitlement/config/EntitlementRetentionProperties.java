/*
 * どこで: Entitlement アプリの設定バインド
 * 何を: retention cleanup のスケジュールと保持期間を保持する
 * なぜ: 削除間隔と有効/無効を運用で調整できるようにするため
 */
package com.dentfinder.entitlement.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "entitlement.retention")
public record EntitlementRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration processedEventTtl) {

  public EntitlementRetentionProperties {
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
    processedEventTtl = processedEventTtl == null ? Duration.ofDays(90) : processedEventTtl;
  }
}
