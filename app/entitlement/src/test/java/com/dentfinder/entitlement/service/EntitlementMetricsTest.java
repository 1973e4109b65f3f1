/*
 * どこで: Entitlement メトリクステスト
 * 何を: webhook/CTA 系メトリクスが記録されることを検証する
 * なぜ: 監視指標の計測回帰を防ぐため
 */
package com.dentfinder.entitlement.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.dentfinder.entitlement.model.RateLimitScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class EntitlementMetricsTest {

  @Test
  void recordsWebhookAndCtaMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final EntitlementMetrics metrics = new EntitlementMetrics(registry);

    metrics.recordWebhookEvent("checkout.session.completed", "processed");
    metrics.recordWebhookEvent("checkout.session.completed", "processed");
    metrics.recordCtaEvent("accepted");
    metrics.recordRateLimited(RateLimitScope.SUBJECT);
    metrics.recordRateLimiterError();

    assertThat(
            registry
                .get("entitlement.webhook.events.total")
                .tag("type", "checkout.session.completed")
                .tag("outcome", "processed")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(registry.get("entitlement.cta.events.total").tag("result", "accepted").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("entitlement.cta.rate_limited.total").tag("scope", "subject").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("entitlement.cta.rate_limiter.errors.total").counter().count())
        .isEqualTo(1.0d);
  }
}
