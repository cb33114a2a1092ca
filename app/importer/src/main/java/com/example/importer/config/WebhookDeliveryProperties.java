/*
 * どこで: Importer アプリの設定バインド
 * 何を: Webhook 非同期配信のポーリング/claim 設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.importer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "importer.webhook.delivery")
public record WebhookDeliveryProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    Duration lease,
    int errorMessageMaxLength) {}
