/*
 * どこで: Importer アプリの設定バインド
 * 何を: Webhook 送信のタイムアウトと応答本文の保存上限を保持する
 * なぜ: 遅い受信側がワーカーを占有し続けないよう固定上限を設けるため
 */
package com.example.importer.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.webhook")
@Validated
public record WebhookProperties(
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @Positive int responseBodyMaxLength) {}
