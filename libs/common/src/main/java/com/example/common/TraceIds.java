package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC に trace_id があればそれを、なければ新規採番した値を返す。 */
  public static String currentOrNew() {
    return orNew(MDC.get(MDC_KEY));
  }

  public static String orNew(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate;
    }
    return newTraceId();
  }
}
