/*
 * どこで: Entitlement サービス層
 * 何を: webhook 処理と CTA 受付のアプリ固有メトリクス記録を集約する
 * なぜ: 再送失敗やレート制限の発生状況を運用で継続監視できるようにするため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.model.RateLimitScope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class EntitlementMetrics {

  private static final String METRIC_WEBHOOK_EVENTS_TOTAL = "entitlement.webhook.events.total";
  private static final String METRIC_CTA_EVENTS_TOTAL = "entitlement.cta.events.total";
  private static final String METRIC_CTA_RATE_LIMITED_TOTAL = "entitlement.cta.rate_limited.total";
  private static final String METRIC_CTA_RATE_LIMITER_ERRORS_TOTAL =
      "entitlement.cta.rate_limiter.errors.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter rateLimiterErrors;

  public EntitlementMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.rateLimiterErrors =
        Counter.builder(METRIC_CTA_RATE_LIMITER_ERRORS_TOTAL)
            .description("Rate limit counter failures that were allowed through")
            .register(meterRegistry);
  }

  /** type はタグ爆発を避けるため、既知の種別以外は呼び出し側で丸めて渡す。 */
  public void recordWebhookEvent(String type, String outcome) {
    increment(
        METRIC_WEBHOOK_EVENTS_TOTAL,
        "Billing webhook events by type and outcome",
        Tags.of("type", type, "outcome", outcome));
  }

  public void recordCtaEvent(String result) {
    increment(METRIC_CTA_EVENTS_TOTAL, "CTA event submissions", Tags.of("result", result));
  }

  public void recordRateLimited(RateLimitScope scope) {
    increment(
        METRIC_CTA_RATE_LIMITED_TOTAL,
        "CTA submissions rejected by rate limit",
        Tags.of("scope", scope.value()));
  }

  public void recordRateLimiterError() {
    rateLimiterErrors.increment();
  }

  private void increment(String name, String description, Tags tags) {
    final String key =
        name
            + tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
