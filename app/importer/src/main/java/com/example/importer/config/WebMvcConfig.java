/*
 * どこで: Importer Web 設定
 * 何を: RequestMdcInterceptor を API リクエストへ適用する
 * なぜ: API ログとキュー投入タスクへ運用キーを安定して埋め込むため
 */
package com.example.importer.config;

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
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/api/**");
  }
}
