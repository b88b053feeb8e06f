/*
 * どこで: Analytics Web 設定
 * 何を: RequestMdcInterceptor を analytics API へ適用する
 * なぜ: API ログへ対象ギルド/ユーザ/試合を安定して埋め込むため
 */
package com.example.analytics.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/analytics/**");
  }
}
