package com.example.importer.metrics;

import com.example.importer.model.JobKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class ImporterMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> jobOutcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> batchRowCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> webhookDeliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final Timer webhookResponseTimer;

  public ImporterMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.webhookResponseTimer =
        Timer.builder("importer.webhook.response_time")
            .description("Webhook endpoint response time")
            .register(meterRegistry);
  }

  /** outcome: done / failed / retry / dead_lettered */
  public void recordJobOutcome(JobKind kind, String outcome) {
    final String key = kind.value() + ":" + outcome;
    jobOutcomeCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder("importer.job.total")
                    .tags(Tags.of("kind", kind.value(), "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordBatchRows(JobKind kind, long rows) {
    if (rows <= 0) {
      return;
    }
    batchRowCounters
        .computeIfAbsent(
            kind.value(),
            value ->
                Counter.builder("importer.batch.rows.total")
                    .tags(Tags.of("kind", value))
                    .register(meterRegistry))
        .increment(rows);
  }

  public void recordWebhookDelivery(String status, Long responseTimeMs) {
    webhookDeliveryCounters
        .computeIfAbsent(
            status,
            value ->
                Counter.builder("importer.webhook.delivery.total")
                    .tags(Tags.of("status", value))
                    .register(meterRegistry))
        .increment();
    if (responseTimeMs != null && responseTimeMs >= 0) {
      webhookResponseTimer.record(Duration.ofMillis(responseTimeMs));
    }
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(
            errorType,
            value ->
                Counter.builder("importer.dependency.error.total")
                    .tags(Tags.of("type", value))
                    .register(meterRegistry))
        .increment();
  }
}
