/*
 * どこで: Importer ドメインモデル
 * 何を: ジョブ種別ごとの状態遷移表を一箇所で定義し検証する
 * なぜ: 前進のみ・終端吸収・FAILED への直行を全書き込み経路で同じ規則にするため
 */
package com.example.importer.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class JobTransitions {

  private static final Map<JobKind, List<JobStatus>> PATHS = new EnumMap<>(JobKind.class);

  static {
    PATHS.put(
        JobKind.IMPORT,
        List.of(
            JobStatus.QUEUED,
            JobStatus.UPLOADING,
            JobStatus.PARSING,
            JobStatus.IMPORTING,
            JobStatus.DONE));
    PATHS.put(
        JobKind.BULK_DELETE,
        List.of(JobStatus.QUEUED, JobStatus.PREPARING, JobStatus.DELETING, JobStatus.DONE));
  }

  private JobTransitions() {}

  public static List<JobStatus> path(JobKind kind) {
    return PATHS.get(kind);
  }

  public static boolean isAllowed(JobKind kind, JobStatus from, JobStatus to) {
    if (from.isTerminal()) {
      return false;
    }
    if (to == JobStatus.FAILED) {
      return true;
    }
    final List<JobStatus> path = PATHS.get(kind);
    final int fromIndex = path.indexOf(from);
    final int toIndex = path.indexOf(to);
    return fromIndex >= 0 && toIndex > fromIndex;
  }

  /** 再配信時に既に通過済みの状態かどうか。true の場合は書き込みを省略する。 */
  public static boolean isBehind(JobKind kind, JobStatus from, JobStatus to) {
    if (from.isTerminal() || to.isTerminal()) {
      return false;
    }
    final List<JobStatus> path = PATHS.get(kind);
    final int fromIndex = path.indexOf(from);
    final int toIndex = path.indexOf(to);
    return fromIndex >= 0 && toIndex >= 0 && toIndex < fromIndex;
  }

  public static void check(JobKind kind, JobStatus from, JobStatus to) {
    if (!isAllowed(kind, from, to)) {
      throw new IllegalJobTransitionException(kind, from, to);
    }
  }
}
