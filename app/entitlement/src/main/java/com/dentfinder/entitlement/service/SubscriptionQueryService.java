/*
 * どこで: Entitlement サービス層
 * 何を: 運用向けのサブスクリプション一覧と状態別件数を返す
 * なぜ: 期限の近い契約や支払い遅延を運用画面から確認するため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.api.SubscriptionCountsResponse;
import com.dentfinder.entitlement.api.SubscriptionSummary;
import com.dentfinder.entitlement.api.SubscriptionsResponse;
import com.dentfinder.entitlement.model.SubscriptionCounts;
import com.dentfinder.entitlement.model.SubscriptionRecord;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import com.dentfinder.entitlement.repository.SubscriptionRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionQueryService {

  private static final String STATUS_ALL = "all";

  private final SubscriptionRepository subscriptionRepository;

  public SubscriptionsResponse list(String statusFilter, int limit, int offset) {
    final SubscriptionStatus status = resolveStatus(statusFilter);
    final List<SubscriptionSummary> items =
        subscriptionRepository.findPage(status, limit, offset).stream()
            .map(this::toSummary)
            .toList();
    return new SubscriptionsResponse(items, limit, offset);
  }

  public SubscriptionCountsResponse counts() {
    final SubscriptionCounts counts = subscriptionRepository.countByStatus();
    return new SubscriptionCountsResponse(
        counts.active(), counts.pastDue(), counts.canceled(), counts.total());
  }

  private SubscriptionStatus resolveStatus(String statusFilter) {
    if (statusFilter == null || statusFilter.isBlank() || STATUS_ALL.equals(statusFilter)) {
      return null;
    }
    return SubscriptionStatus.fromValue(statusFilter)
        .orElseThrow(() -> new IllegalArgumentException("status is invalid"));
  }

  private SubscriptionSummary toSummary(SubscriptionRecord record) {
    return new SubscriptionSummary(
        record.subscriptionId(),
        record.customerId(),
        record.storeId(),
        record.userId(),
        record.tier().value(),
        record.status().value(),
        record.currentPeriodEnd(),
        record.createdAt());
  }
}
