/*
 * どこで: Importer ジョブ受付
 * 何を: アップロードされた CSV を一時ディレクトリへ保存し、終端時に削除する
 * なぜ: リトライ中は同じファイルを再読込でき、終端後はディスクを残さないようにするため
 */
package com.example.importer.job;

import com.example.importer.config.IngestProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UploadStorage {

  private static final Logger logger = LoggerFactory.getLogger(UploadStorage.class);

  private final Path uploadDir;

  public UploadStorage(IngestProperties properties) {
    this.uploadDir = Path.of(properties.uploadDir());
  }

  public Path store(UUID jobId, InputStream content) {
    final Path target = uploadDir.resolve(jobId + ".csv");
    try (InputStream input = content) {
      Files.createDirectories(uploadDir);
      Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
      return target;
    } catch (IOException ex) {
      release(target.toString());
      throw new UncheckedIOException("failed to store upload jobId=" + jobId, ex);
    }
  }

  public void release(String sourcePath) {
    if (sourcePath == null || sourcePath.isBlank()) {
      return;
    }
    try {
      if (Files.deleteIfExists(Path.of(sourcePath))) {
        logger.debug("upload released path={}", sourcePath);
      }
    } catch (IOException ex) {
      logger.warn("failed to release upload path={}", sourcePath, ex);
    }
  }
}
