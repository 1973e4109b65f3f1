package com.dentfinder.entitlement.service;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.dentfinder.entitlement.config.EntitlementRetentionProperties;
import com.dentfinder.entitlement.repository.ProcessedWebhookEventRepository;
import com.dentfinder.entitlement.repository.RateLimitCounterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class EntitlementRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

  @Test
  void cleanupUsesConfiguredTtlAndCurrentTime() {
    final ProcessedWebhookEventRepository processedEventRepository =
        mock(ProcessedWebhookEventRepository.class);
    final RateLimitCounterRepository counterRepository = mock(RateLimitCounterRepository.class);
    final EntitlementRetentionService service =
        new EntitlementRetentionService(
            processedEventRepository,
            counterRepository,
            new EntitlementRetentionProperties(true, Duration.ofHours(1), Duration.ofDays(90)),
            Clock.fixed(NOW, ZoneOffset.UTC));

    service.cleanup();

    verify(processedEventRepository).deleteProcessedBefore(NOW.minus(Duration.ofDays(90)));
    verify(counterRepository).deleteExpired(NOW);
  }
}
