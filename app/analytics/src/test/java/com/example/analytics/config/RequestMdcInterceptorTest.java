package com.example.analytics.config;

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
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/analytics/guilds/10/users/20/killed-by");
    request.addHeader("X-Request-Id", "req-1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
        Map.of("guildId", "10", "userId", "20"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/analytics/guilds/10/users/20/killed-by");
    assertThat(MDC.get("guild_id")).isEqualTo("10");
    assertThat(MDC.get("user_id")).isEqualTo("20");
    assertThat(MDC.get("match_id")).isNull();

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("guild_id")).isNull();
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/analytics/matches/5/statistics");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
  }
}
