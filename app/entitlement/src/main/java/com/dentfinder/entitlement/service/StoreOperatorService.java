/*
 * どこで: Entitlement サービス層
 * 何を: 運用者による掲載フラグ/ティア/掲載期限の手動操作と参照を提供する
 * なぜ: webhook を経由しない補正操作を、webhook と同じテーブル規則で行うため
 */
package com.dentfinder.entitlement.service;

import com.dentfinder.entitlement.api.StoreEntitlementResponse;
import com.dentfinder.entitlement.api.StoreNotFoundException;
import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.model.StoreEntitlementRecord;
import com.dentfinder.entitlement.repository.StoreRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StoreOperatorService {

  private static final Logger logger = LoggerFactory.getLogger(StoreOperatorService.class);
  private static final String TIER_NONE = "none";

  private final StoreRepository storeRepository;
  private final Clock clock;

  public StoreEntitlementResponse getEntitlement(long storeId) {
    return storeRepository
        .findEntitlement(storeId)
        .map(this::toResponse)
        .orElseThrow(() -> new StoreNotFoundException(storeId));
  }

  /** 掲載フラグを書き換える唯一の経路。 */
  @Transactional
  public StoreEntitlementResponse setFeatured(long storeId, boolean featured) {
    requireUpdated(storeRepository.setFeatured(storeId, featured), storeId);
    logger.info("store featured flag changed storeId={} featured={}", storeId, featured);
    return getEntitlement(storeId);
  }

  /**
   * ティアを手動で設定する。
   *
   * @param tierValue monthly/annual、またはティアなしを表す none/null
   * @param featuredUntil null かつティア指定ありの場合はティアの期間から算出する
   */
  @Transactional
  public StoreEntitlementResponse assignTier(long storeId, String tierValue, Instant featuredUntil) {
    final FeaturedTier tier = resolveTier(tierValue);
    final Instant until =
        tier != null && featuredUntil == null ? tier.featuredUntil(Instant.now(clock)) : featuredUntil;
    requireUpdated(storeRepository.assignTier(storeId, tier, until), storeId);
    logger.info(
        "store tier assigned storeId={} tier={} featuredUntil={}",
        storeId,
        tier == null ? TIER_NONE : tier.value(),
        until);
    return getEntitlement(storeId);
  }

  @Transactional
  public StoreEntitlementResponse extendFeatured(long storeId, int days) {
    final Instant until =
        storeRepository
            .extendFeaturedUntilByDays(storeId, days, Instant.now(clock))
            .orElseThrow(() -> new StoreNotFoundException(storeId));
    logger.info("store featured window extended storeId={} days={} featuredUntil={}", storeId, days, until);
    return getEntitlement(storeId);
  }

  private FeaturedTier resolveTier(String tierValue) {
    if (tierValue == null || TIER_NONE.equals(tierValue)) {
      return null;
    }
    return FeaturedTier.fromValue(tierValue)
        .orElseThrow(() -> new IllegalArgumentException("tier is invalid"));
  }

  private void requireUpdated(int updated, long storeId) {
    if (updated == 0) {
      throw new StoreNotFoundException(storeId);
    }
  }

  private StoreEntitlementResponse toResponse(StoreEntitlementRecord record) {
    return new StoreEntitlementResponse(
        record.storeId(),
        record.tier() == null ? TIER_NONE : record.tier().value(),
        record.featuredUntil(),
        record.featuredActive(Instant.now(clock)),
        record.featured());
  }
}
