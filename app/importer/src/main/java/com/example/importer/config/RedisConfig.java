/*
 * どこで: Importer インフラ設定
 * 何を: 進捗ストアが使う StringRedisTemplate と pub/sub リスナーコンテナを提供する
 * なぜ: 進捗ハッシュの読み書きとチャネル購読を同じ接続設定で行うため
 *       リスナーは単一スレッドで順に呼び、同じジョブの更新が SSE に逆順で届かないようにする
 */
package com.example.importer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  RedisMessageListenerContainer progressListenerContainer(
      RedisConnectionFactory connectionFactory) {
    final RedisMessageListenerContainer container = new RedisMessageListenerContainer();
    container.setConnectionFactory(connectionFactory);
    container.setTaskExecutor(progressListenerExecutor());
    // ブロッキング購読のクライアントでも配信スレッドを占有しないよう分けておく
    container.setSubscriptionExecutor(new SimpleAsyncTaskExecutor("progress-subscription-"));
    return container;
  }

  static ThreadPoolTaskExecutor progressListenerExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("progress-listener-");
    executor.setDaemon(true);
    executor.initialize();
    return executor;
  }
}
