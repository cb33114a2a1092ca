/*
 * どこで: Importer ドメインモデル
 * 何を: ワークロードごとのキュー(JetStream subject)を表す
 * なぜ: 重い取込と削除を別 consumer で流量制御するため
 */
package com.example.importer.model;

public enum JobQueue {
  IMPORT("import"),
  BULK_DELETE("bulk-delete"),
  DEFAULT("default");

  private final String value;

  JobQueue(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
