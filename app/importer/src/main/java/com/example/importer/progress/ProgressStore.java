/*
 * どこで: Importer 進捗ストア
 * 何を: ジョブ進捗の保存(キャッチアップ用)と配信(ライブ購読用)の窓口を定義する
 * なぜ: エンジンと SSE 配信を Redis 実装から切り離し、テストで差し替えられるようにするため
 */
package com.example.importer.progress;

import com.example.importer.model.ProgressSnapshot;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

public interface ProgressStore {

  /**
   * スナップショットを保存し TTL を張り直す。
   *
   * @return 保存時に付与した updated_at
   */
  Instant setProgress(UUID jobId, ProgressSnapshot snapshot);

  /** TTL 切れ、または未登録のジョブは empty。 */
  Optional<ProgressSnapshot> getProgress(UUID jobId);

  /**
   * 進捗差分をジョブのトピックへ配信する。updated_at が無ければ付与する。
   *
   * @return 受信した購読者数。0 はエラーではない
   */
  long publishUpdate(UUID jobId, Map<String, Object> delta);

  /** ジョブのトピックを購読する。listener には JSON 文字列がそのまま渡る。 */
  ProgressSubscription subscribe(UUID jobId, Consumer<String> listener);
}
