/*
 * どこで: Importer API
 * 何を: CSV アップロードを受け付けて取込ジョブを開始する
 * なぜ: 大きなファイルでもリクエスト内で処理せず、ジョブ ID を即時に返すため
 */
package com.example.importer.api;

import com.example.importer.api.response.JobAcceptedResponse;
import com.example.importer.job.JobService;
import com.example.importer.model.JobRecord;
import com.example.importer.model.JobStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UploadController {

  private final JobService jobService;

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<JobAcceptedResponse> upload(@RequestPart("file") MultipartFile file) {
    final String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isBlank()) {
      throw new InvalidUploadException("Filename is required");
    }
    if (!fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
      throw new InvalidUploadException("Invalid file type. Expected .csv, got " + fileName);
    }
    final JobRecord job;
    try {
      job = jobService.startImport(fileName, file.getInputStream());
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read upload", ex);
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new JobAcceptedResponse(
                job.jobId(), JobStatus.QUEUED.value(), "File uploaded; import queued"));
  }
}
