/*
 * どこで: Importer ドメインモデル
 * 何を: ジョブ種別(CSV 取込 / 一括削除)を表す
 * なぜ: キュー振り分けと状態遷移表の切り替えに使うため
 */
package com.example.importer.model;

import java.util.Locale;

public enum JobKind {
  IMPORT("import"),
  BULK_DELETE("bulk_delete");

  private final String value;

  JobKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static JobKind fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("job kind is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (JobKind kind : values()) {
      if (kind.value.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown job kind: " + value);
  }
}
