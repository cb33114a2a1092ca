package com.example.importer.webhook;

/**
 * 1 回の POST の結果。送信失敗も例外ではなくこの値で表す。
 *
 * @param responseCode 応答を受け取れなかった場合は null
 * @param errorMessage 成功時は null
 */
public record WebhookSendResult(
    boolean success,
    Integer responseCode,
    String responseBody,
    int responseTimeMs,
    String errorMessage) {}
