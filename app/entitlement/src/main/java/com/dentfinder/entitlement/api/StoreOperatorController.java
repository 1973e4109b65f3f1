/*
 * どこで: Entitlement 内部 API
 * 何を: 運用者向けの店舗掲載操作と参照を提供する
 * なぜ: 管理画面から webhook 以外の補正を行えるようにするため
 */
package com.dentfinder.entitlement.api;

import com.dentfinder.entitlement.service.StoreOperatorService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/v1/stores/{store_id}")
@RequiredArgsConstructor
@Validated
public class StoreOperatorController {

    private final StoreOperatorService storeOperatorService;

    @GetMapping("/entitlement")
    public StoreEntitlementResponse get(
            @PathVariable("store_id") @Positive(message = "store_id must be positive") long storeId) {
        return storeOperatorService.getEntitlement(storeId);
    }

    @PutMapping("/featured")
    public StoreEntitlementResponse setFeatured(
            @PathVariable("store_id") @Positive(message = "store_id must be positive") long storeId,
            @Valid @RequestBody FeaturedFlagRequest request) {
        return storeOperatorService.setFeatured(storeId, request.isFeatured());
    }

    @PutMapping("/tier")
    public StoreEntitlementResponse assignTier(
            @PathVariable("store_id") @Positive(message = "store_id must be positive") long storeId,
            @RequestBody TierAssignmentRequest request) {
        return storeOperatorService.assignTier(storeId, request.tier(), request.featuredUntil());
    }

    @PostMapping("/featured-until/extensions")
    public StoreEntitlementResponse extendFeatured(
            @PathVariable("store_id") @Positive(message = "store_id must be positive") long storeId,
            @Valid @RequestBody FeaturedExtensionRequest request) {
        return storeOperatorService.extendFeatured(storeId, request.days());
    }
}
