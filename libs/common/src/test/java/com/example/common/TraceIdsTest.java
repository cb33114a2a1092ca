package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void clearMdc() {
    MDC.remove(TraceIds.MDC_KEY);
  }

  @Test
  void currentOrNewPrefersMdcValue() {
    MDC.put(TraceIds.MDC_KEY, "trace-1");

    assertThat(TraceIds.currentOrNew()).isEqualTo("trace-1");
  }

  @Test
  void orNewGeneratesWhenBlank() {
    assertThat(TraceIds.orNew(" ")).isNotBlank().isNotEqualTo(" ");
    assertThat(TraceIds.orNew(null)).hasSize(36);
  }

  @Test
  void timestampConversionKeepsNulls() {
    final Instant instant = Instant.parse("2026-01-17T00:00:00Z");

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant((Timestamp) null)).isNull();
  }
}
