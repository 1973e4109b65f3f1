/*
 * どこで: CTA イベント API の Web 層テスト
 * 何を: 入力検証、店舗不在、レート制限の応答形式を検証する
 * なぜ: 公開エンドポイントのエラー応答を一貫させるため
 */
package com.dentfinder.entitlement.api;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dentfinder.entitlement.config.EntitlementSecurityConfig;
import com.dentfinder.entitlement.model.RateLimitScope;
import com.dentfinder.entitlement.service.CtaEventService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CtaEventController.class)
@Import({ApiExceptionHandler.class, EntitlementSecurityConfig.class})
@TestPropertySource(properties = "entitlement.internal-api.token=test-internal-token")
class CtaEventControllerTest {

  private static final String VALID_BODY =
      """
      {
        "subject_id": 42,
        "event_type": "call",
        "source": "/stores/42"
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CtaEventService ctaEventService;

  @Test
  void acceptsValidEventWithForwardedAddress() throws Exception {
    mockMvc
        .perform(
            post("/v1/cta-events")
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));

    verify(ctaEventService).record(42L, "call", "/stores/42", "203.0.113.7");
  }

  @Test
  void rejectsMissingSubjectId() throws Exception {
    final String body =
        """
        {
          "event_type": "call",
          "source": "/stores/42"
        }
        """;

    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("subject_id is required"));

    verify(ctaEventService, never()).record(anyLong(), anyString(), anyString(), anyString());
  }

  @Test
  void rejectsBlankSource() throws Exception {
    final String body =
        """
        {
          "subject_id": 42,
          "event_type": "website",
          "source": " "
        }
        """;

    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("source is required"));
  }

  @Test
  void rejectsMalformedJson() throws Exception {
    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content("{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void mapsUnknownEventTypeToBadRequest() throws Exception {
    doThrow(new IllegalArgumentException("event_type is invalid"))
        .when(ctaEventService)
        .record(anyLong(), anyString(), anyString(), anyString());

    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("event_type is invalid"));
  }

  @Test
  void mapsUnknownStoreToNotFound() throws Exception {
    doThrow(new StoreNotFoundException(42L))
        .when(ctaEventService)
        .record(anyLong(), anyString(), anyString(), anyString());

    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("STORE_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("store not found: 42"));
  }

  @Test
  void mapsRateLimitToTooManyRequests() throws Exception {
    doThrow(new RateLimitExceededException(RateLimitScope.ORIGIN))
        .when(ctaEventService)
        .record(anyLong(), anyString(), anyString(), anyString());

    mockMvc
        .perform(post("/v1/cta-events").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
        .andExpect(jsonPath("$.message").value("rate limited"));
  }
}
