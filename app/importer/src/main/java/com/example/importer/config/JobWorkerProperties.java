/*
 * どこで: Importer アプリの設定バインド
 * 何を: ワーカーのリトライ/バックオフ/時間制限を保持する
 * なぜ: 一時障害の再試行回数と打ち切り時間を運用で調整するため
 */
package com.example.importer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.worker")
@Validated
public record JobWorkerProperties(
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @NotNull Duration softTimeLimit,
    @NotNull Duration hardTimeLimit,
    @NotNull Duration lockRetryDelay,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "importer.worker.soft-time-limit must be shorter than hard-time-limit")
  public boolean isSoftLimitBeforeHardLimit() {
    if (softTimeLimit == null || hardTimeLimit == null) {
      return true;
    }
    return !softTimeLimit.isNegative()
        && !softTimeLimit.isZero()
        && softTimeLimit.compareTo(hardTimeLimit) < 0;
  }

  @AssertTrue(message = "importer.worker.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin >= 0.0d && backoffJitterMin <= backoffJitterMax;
  }
}
