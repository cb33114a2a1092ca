/*
 * どこで: Importer アプリの設定バインド
 * 何を: NATS 接続設定をプロパティから読み込む
 * なぜ: 環境ごとの接続先を切り替え、テストでは NATS を無効化するため
 */
package com.example.importer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "nats")
@Validated
public record NatsProperties(
    boolean enabled, @NotBlank String url, @Positive Integer connectionTimeout) {}
