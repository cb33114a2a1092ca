/*
 * どこで: Importer 取込エンジン
 * 何を: アップロード済み CSV をヘッダー検証 → 件数確定 → 固定サイズのバッチ upsert で取り込む
 * なぜ: メモリを入力サイズに比例させず、再配信で同じバッチを再適用しても結果が変わらないようにするため
 */
package com.example.importer.engine;

import com.example.importer.config.IngestProperties;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.model.ProductRow;
import com.example.importer.model.RowError;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.repository.ImportRowErrorRepository;
import com.example.importer.repository.ProductRepository;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class CsvImportEngine implements JobEngine {

  private static final Logger logger = LoggerFactory.getLogger(CsvImportEngine.class);

  static final CSVFormat CSV_FORMAT =
      CSVFormat.DEFAULT
          .builder()
          .setHeader()
          .setSkipHeaderRecord(true)
          .setIgnoreSurroundingSpaces(true)
          .setIgnoreEmptyLines(true)
          .setAllowMissingColumnNames(true)
          .build();

  private final ProductRepository productRepository;
  private final ImportRowErrorRepository rowErrorRepository;
  private final TransactionTemplate transactionTemplate;
  private final IngestProperties properties;
  private final ImporterMetrics metrics;
  private final Clock clock;

  @Override
  public JobKind kind() {
    return JobKind.IMPORT;
  }

  @Override
  public void run(JobTask task, JobProgressTracker tracker, BatchCheckpoint checkpoint) {
    final Path source = resolveSource(task);
    tracker.transition(JobStatus.PARSING, "validating_headers");
    final CsvColumns columns = readColumns(source);
    if (!columns.unknownHeaders().isEmpty()) {
      logger.warn(
          "csv contains unknown columns jobId={} columns={}", task.jobId(), columns.unknownHeaders());
    }
    tracker.transition(JobStatus.PARSING, "counting_rows");
    tracker.knownTotal(countRows(source));
    tracker.transition(JobStatus.IMPORTING, "batch_0");
    importRows(task.jobId(), source, columns, tracker, checkpoint);
    tracker.complete("completed");
    logger.info(
        "import completed jobId={} processedRows={} rowErrors={}",
        task.jobId(),
        tracker.current().processedRows(),
        tracker.current().rowErrorCount());
  }

  private Path resolveSource(JobTask task) {
    if (task.sourcePath() == null || task.sourcePath().isBlank()) {
      throw new JobPayloadException("import task has no source file");
    }
    final Path source = Path.of(task.sourcePath());
    if (!Files.isRegularFile(source)) {
      throw new JobPayloadException("CSV file not found at " + source);
    }
    return source;
  }

  private CsvColumns readColumns(Path source) {
    try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        CSVParser parser = CSV_FORMAT.parse(reader)) {
      return CsvColumns.resolve(parser.getHeaderNames());
    } catch (IllegalArgumentException ex) {
      // ヘッダー行自体が壊れている
      throw new CsvHeaderValidationException("Malformed CSV header: " + ex.getMessage());
    } catch (UncheckedIOException ex) {
      if (ex.getCause() instanceof CharacterCodingException coding) {
        throw notUtf8(coding);
      }
      throw new JobPayloadException("CSV parsing error: " + ex.getMessage(), ex);
    } catch (CharacterCodingException ex) {
      throw notUtf8(ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read CSV header", ex);
    }
  }

  // 全行を先に読み切るため、構文エラーのあるファイルは 1 行も書き込まずに失敗する
  private long countRows(Path source) {
    try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        CSVParser parser = CSV_FORMAT.parse(reader)) {
      long count = 0L;
      for (CSVRecord ignored : parser) {
        count++;
      }
      return count;
    } catch (UncheckedIOException ex) {
      if (ex.getCause() instanceof CharacterCodingException coding) {
        throw notUtf8(coding);
      }
      throw new JobPayloadException("CSV parsing error: " + ex.getMessage(), ex);
    } catch (CharacterCodingException ex) {
      throw notUtf8(ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to count CSV rows", ex);
    }
  }

  private void importRows(
      UUID jobId,
      Path source,
      CsvColumns columns,
      JobProgressTracker tracker,
      BatchCheckpoint checkpoint) {
    final int batchSize = properties.batchSize();
    final List<ProductRow> rows = new ArrayList<>(batchSize);
    final List<RowError> errors = new ArrayList<>();
    long rowNumber = 0L;
    long errorCount = 0L;
    int pending = 0;
    int batchNumber = 0;
    try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        CSVParser parser = CSV_FORMAT.parse(reader)) {
      for (CSVRecord record : parser) {
        rowNumber++;
        final CsvColumns.ParsedRow parsed = columns.parse(record, rowNumber);
        if (parsed.isValid()) {
          rows.add(parsed.row());
        } else {
          errorCount++;
          // 上限を超えた行エラーは件数だけ数える
          if (errorCount <= properties.rowErrorLimit()) {
            errors.add(parsed.error());
          }
        }
        pending++;
        if (pending >= batchSize) {
          batchNumber++;
          commitBatch(jobId, rows, errors, batchNumber);
          tracker.rowErrors(errorCount);
          tracker.advance(rowNumber, "batch_" + batchNumber);
          pending = 0;
          checkpoint.afterBatch();
        }
      }
      if (pending > 0) {
        batchNumber++;
        commitBatch(jobId, rows, errors, batchNumber);
        tracker.rowErrors(errorCount);
        tracker.advance(rowNumber, "batch_" + batchNumber);
        checkpoint.afterBatch();
      }
    } catch (UncheckedIOException ex) {
      if (ex.getCause() instanceof CharacterCodingException coding) {
        throw notUtf8(coding);
      }
      throw new JobPayloadException("CSV parsing error at row " + (rowNumber + 1), ex);
    } catch (CharacterCodingException ex) {
      throw notUtf8(ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read CSV rows", ex);
    }
  }

  // 文字コード不正は再試行しても直らない
  private static JobPayloadException notUtf8(CharacterCodingException ex) {
    return new JobPayloadException("CSV file is not valid UTF-8: " + ex, ex);
  }

  private void commitBatch(UUID jobId, List<ProductRow> rows, List<RowError> errors, int batchNumber) {
    final Instant now = Instant.now(clock);
    final Integer changed =
        transactionTemplate.execute(
            status -> {
              final int count = productRepository.upsertAll(rows, now);
              rowErrorRepository.insertAll(jobId, errors);
              return count;
            });
    logger.debug(
        "import batch committed jobId={} batch={} rows={} changed={} rowErrors={}",
        jobId,
        batchNumber,
        rows.size(),
        changed,
        errors.size());
    metrics.recordBatchRows(JobKind.IMPORT, rows.size());
    rows.clear();
    errors.clear();
  }
}
