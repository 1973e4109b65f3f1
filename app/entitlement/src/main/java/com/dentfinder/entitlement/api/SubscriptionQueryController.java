/*
 * どこで: Entitlement 内部 API
 * 何を: 運用者向けのサブスクリプション一覧と件数を返す
 * なぜ: 管理画面の契約一覧を DB 直参照なしで提供するため
 */
package com.dentfinder.entitlement.api;

import com.dentfinder.entitlement.service.SubscriptionQueryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/v1/subscriptions")
@RequiredArgsConstructor
@Validated
public class SubscriptionQueryController {

    private final SubscriptionQueryService subscriptionQueryService;

    @GetMapping
    public SubscriptionsResponse list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", defaultValue = "50")
            @Min(value = 1, message = "limit must be between 1 and 200")
            @Max(value = 200, message = "limit must be between 1 and 200")
            int limit,
            @RequestParam(value = "offset", defaultValue = "0")
            @Min(value = 0, message = "offset must not be negative")
            int offset) {
        return subscriptionQueryService.list(status, limit, offset);
    }

    @GetMapping("/counts")
    public SubscriptionCountsResponse counts() {
        return subscriptionQueryService.counts();
    }
}
