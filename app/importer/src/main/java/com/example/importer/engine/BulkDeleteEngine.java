/*
 * どこで: Importer 一括削除エンジン
 * 何を: 開始時点の商品を id 順の固定サイズバッチで削除し、バッチごとに進捗を記録する
 * なぜ: 長時間ロックを避けつつ、途中再実行でも削除済みキーを無害に扱えるようにするため
 */
package com.example.importer.engine;

import com.example.importer.config.IngestProperties;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.repository.JobRepository;
import com.example.importer.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class BulkDeleteEngine implements JobEngine {

  private static final Logger logger = LoggerFactory.getLogger(BulkDeleteEngine.class);

  private final ProductRepository productRepository;
  private final JobRepository jobRepository;
  private final TransactionTemplate transactionTemplate;
  private final IngestProperties properties;
  private final ImporterMetrics metrics;

  @Override
  public JobKind kind() {
    return JobKind.BULK_DELETE;
  }

  @Override
  public void run(JobTask task, JobProgressTracker tracker, BatchCheckpoint checkpoint) {
    tracker.transition(JobStatus.PREPARING, "counting_products");
    tracker.knownTotal(productRepository.count());
    final long total = tracker.current().totalRows();
    // 初回実行時点の最大 id をジョブに固定する。以後に作られた商品は再配信後も対象外
    final long maxId = jobRepository.captureDeleteMaxId(task.jobId(), productRepository.maxId());
    tracker.transition(JobStatus.DELETING, "batch_0");

    long deleted = tracker.current().processedRows();
    int batchNumber = 0;
    while (true) {
      final Integer removed =
          transactionTemplate.execute(
              status -> productRepository.deleteBatch(properties.deleteBatchSize(), maxId));
      if (removed == null || removed == 0) {
        break;
      }
      batchNumber++;
      deleted += removed;
      metrics.recordBatchRows(JobKind.BULK_DELETE, removed);
      tracker.advance(deleted, "batch_" + batchNumber);
      checkpoint.afterBatch();
    }
    tracker.advance(total, "completed");
    tracker.complete("completed");
    logger.info(
        "bulk delete completed jobId={} batches={} totalProducts={}", task.jobId(), batchNumber, total);
  }
}
