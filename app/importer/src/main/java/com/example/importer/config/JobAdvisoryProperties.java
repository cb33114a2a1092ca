/*
 * どこで: Importer アプリの設定バインド
 * 何を: MaxDeliver advisory 購読の subject/stream/durable を保持する
 * なぜ: 再配信上限に達したタスクを DLQ へ落とす安全網を設定で切り替えるため
 */
package com.example.importer.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.advisory")
@Validated
public record JobAdvisoryProperties(
    boolean enabled, @NotBlank String subject, @NotBlank String stream, @NotBlank String durable) {}
