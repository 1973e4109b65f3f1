/*
 * どこで: StoreRepository の統合テスト
 * 何を: ティア付与、掲載期間更新、運用操作の SQL を検証する
 * なぜ: webhook と運用操作がそれぞれ自分の列だけを書き換えることを保証するため
 */
package com.dentfinder.entitlement.repository;

import com.dentfinder.entitlement.AbstractPostgresContainerTest;
import com.dentfinder.entitlement.StoreFixtures;
import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.model.StoreEntitlementRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StoreRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");
    private static final long MISSING_STORE_ID = 999_999L;

    @Autowired
    private StoreRepository storeRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        StoreFixtures.cleanAll(jdbcTemplate);
    }

    @Test
    void grantTierSetsTierAndWindowWithoutTouchingFeaturedFlag() {
        long storeId = StoreFixtures.insertStore(jdbcTemplate, "Smile Dental");
        Instant until = FeaturedTier.ANNUAL.featuredUntil(NOW);

        assertThat(storeRepository.grantTier(storeId, FeaturedTier.ANNUAL, until)).isEqualTo(1);

        StoreEntitlementRecord record = storeRepository.findEntitlement(storeId).orElseThrow();
        assertThat(record.tier()).isEqualTo(FeaturedTier.ANNUAL);
        assertThat(record.featuredUntil()).isEqualTo(until);
        assertThat(record.featured()).isFalse();
    }

    @Test
    void extendFeatureWindowKeepsTier() {
        long storeId = StoreFixtures.insertStore(jdbcTemplate, "Bright Teeth");
        storeRepository.grantTier(storeId, FeaturedTier.MONTHLY, NOW.plus(Duration.ofDays(30)));
        Instant extended = NOW.plus(Duration.ofDays(61));

        assertThat(storeRepository.extendFeatureWindow(storeId, extended)).isEqualTo(1);

        StoreEntitlementRecord record = storeRepository.findEntitlement(storeId).orElseThrow();
        assertThat(record.tier()).isEqualTo(FeaturedTier.MONTHLY);
        assertThat(record.featuredUntil()).isEqualTo(extended);
    }

    @Test
    void writesToMissingStoreAffectNoRows() {
        assertThat(storeRepository.existsById(MISSING_STORE_ID)).isFalse();
        assertThat(storeRepository.grantTier(MISSING_STORE_ID, FeaturedTier.MONTHLY, NOW)).isZero();
        assertThat(storeRepository.extendFeatureWindow(MISSING_STORE_ID, NOW)).isZero();
        assertThat(storeRepository.setFeatured(MISSING_STORE_ID, true)).isZero();
        assertThat(storeRepository.extendFeaturedUntilByDays(MISSING_STORE_ID, 10, NOW)).isEmpty();
    }

    @Test
    void setFeaturedAndAssignTierAreIndependent() {
        long storeId = StoreFixtures.insertStore(jdbcTemplate, "Family Ortho");

        storeRepository.setFeatured(storeId, true);
        storeRepository.assignTier(storeId, null, null);

        StoreEntitlementRecord record = storeRepository.findEntitlement(storeId).orElseThrow();
        assertThat(record.featured()).isTrue();
        assertThat(record.tier()).isNull();
        assertThat(record.featuredUntil()).isNull();
    }

    @Test
    void extendFeaturedUntilByDaysStartsFromLaterOfNowAndCurrentWindow() {
        long expiredStore = StoreFixtures.insertStore(jdbcTemplate, "Expired");
        long activeStore = StoreFixtures.insertStore(jdbcTemplate, "Active");
        storeRepository.assignTier(expiredStore, FeaturedTier.MONTHLY, NOW.minus(Duration.ofDays(5)));
        storeRepository.assignTier(activeStore, FeaturedTier.MONTHLY, NOW.plus(Duration.ofDays(5)));

        Instant expiredResult =
                storeRepository.extendFeaturedUntilByDays(expiredStore, 10, NOW).orElseThrow();
        Instant activeResult =
                storeRepository.extendFeaturedUntilByDays(activeStore, 10, NOW).orElseThrow();

        assertThat(expiredResult).isEqualTo(NOW.plus(Duration.ofDays(10)));
        assertThat(activeResult).isEqualTo(NOW.plus(Duration.ofDays(15)));
    }

    @Test
    void featuredActiveDependsOnWindowOnly() {
        long storeId = StoreFixtures.insertStore(jdbcTemplate, "Window");
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        storeRepository.grantTier(storeId, FeaturedTier.MONTHLY, now.plus(Duration.ofDays(1)));

        StoreEntitlementRecord record = storeRepository.findEntitlement(storeId).orElseThrow();

        assertThat(record.featuredActive(now)).isTrue();
        assertThat(record.featuredActive(now.plus(Duration.ofDays(2)))).isFalse();
    }
}
