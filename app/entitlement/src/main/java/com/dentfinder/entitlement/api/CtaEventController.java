/*
 * どこで: Entitlement API
 * 何を: 店舗ページの CTA クリックを受け付ける公開エンドポイントを提供する
 * なぜ: 認証なしで受ける入口を検証とレート制限の背後に置くため
 */
package com.dentfinder.entitlement.api;

import com.dentfinder.entitlement.config.ClientIpResolver;
import com.dentfinder.entitlement.service.CtaEventService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class CtaEventController {

    private final CtaEventService ctaEventService;

    @PostMapping("/cta-events")
    public CtaEventAckResponse record(
            @Valid @RequestBody CtaEventRequest request, HttpServletRequest servletRequest) {
        ctaEventService.record(
                request.subjectId(),
                request.eventType(),
                request.source(),
                ClientIpResolver.resolve(servletRequest));
        return new CtaEventAckResponse(true);
    }
}
