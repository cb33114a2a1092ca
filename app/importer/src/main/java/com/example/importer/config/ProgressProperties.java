package com.example.importer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.progress")
@Validated
public record ProgressProperties(
    @NotBlank String keyPrefix,
    @NotBlank String lockKeyPrefix,
    @NotNull Duration ttl,
    @NotNull Duration publishInterval,
    @NotNull Duration streamTimeout,
    @NotNull Duration heartbeatInterval) {

  @AssertTrue(message = "importer.progress.ttl must be positive")
  public boolean isTtlPositive() {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }

  @AssertTrue(message = "importer.progress.publish-interval must not be negative")
  public boolean isPublishIntervalValid() {
    return publishInterval != null && !publishInterval.isNegative();
  }

  @AssertTrue(message = "importer.progress.heartbeat-interval must be positive")
  public boolean isHeartbeatIntervalPositive() {
    return heartbeatInterval != null && !heartbeatInterval.isZero() && !heartbeatInterval.isNegative();
  }
}
