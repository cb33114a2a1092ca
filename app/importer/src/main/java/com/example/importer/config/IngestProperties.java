/*
 * どこで: Importer アプリの設定バインド
 * 何を: 取込/削除のバッチサイズと行エラー保存上限、アップロード一時置き場を保持する
 * なぜ: メモリ使用量と 1 トランザクションの大きさを固定上限で抑えるため
 */
package com.example.importer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.ingest")
@Validated
public record IngestProperties(
    @Positive int batchSize,
    @Positive int deleteBatchSize,
    @PositiveOrZero int rowErrorLimit,
    @NotBlank String uploadDir) {}
