/*
 * どこで: Importer 設定
 * 何を: Webhook 送信専用 RestClient を提供する
 * なぜ: 受信側ごとに URL が異なるため baseUrl を持たせず、接続/読み取りタイムアウトだけを固定するため
 */
package com.example.importer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class WebhookClientConfig {

  @Bean
  RestClient webhookRestClient(RestClient.Builder builder, WebhookProperties properties) {
    return builder.requestFactory(requestFactory(properties)).build();
  }

  public static SimpleClientHttpRequestFactory requestFactory(WebhookProperties properties) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.connectTimeout());
    factory.setReadTimeout(properties.readTimeout());
    return factory;
  }
}
