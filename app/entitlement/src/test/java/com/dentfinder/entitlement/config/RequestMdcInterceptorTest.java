/*
 * どこで: RequestMdcInterceptor の単体テスト
 * 何を: MDC への投入と完了時の除去を検証する
 * なぜ: スレッド再利用時に前のリクエストのキーがログへ混入しないことを保証するため
 */
package com.dentfinder.entitlement.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void putsRequestKeysAndRemovesThemAfterCompletion() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("PUT", "/internal/v1/stores/42/featured");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "198.51.100.4, 10.0.0.1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("store_id", "42"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("PUT");
    assertThat(MDC.get("http_path")).isEqualTo("/internal/v1/stores/42/featured");
    assertThat(MDC.get("client_ip")).isEqualTo("198.51.100.4");
    assertThat(MDC.get("store_id")).isEqualTo("42");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
    assertThat(MDC.get("store_id")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderAbsent() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/cta-events");
    request.addHeader("X-Real-IP", "192.0.2.9");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.9");
    assertThat(MDC.get("store_id")).isNull();
  }
}
