/*
 * どこで: Importer API
 * 何を: ジョブ進捗と行エラーの参照、一括削除ジョブの開始を公開する
 * なぜ: SSE を使わないクライアントもポーリングで状態を取得できるようにするため
 */
package com.example.importer.api;

import com.example.importer.api.response.JobAcceptedResponse;
import com.example.importer.api.response.JobProgressResponse;
import com.example.importer.api.response.RowErrorsResponse;
import com.example.importer.job.JobService;
import com.example.importer.model.JobRecord;
import com.example.importer.model.JobStatus;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class JobController {

  private final JobService jobService;

  @GetMapping("/jobs/{jobId}")
  public JobProgressResponse getJob(@PathVariable("jobId") UUID jobId) {
    return JobProgressResponse.from(jobId, jobService.snapshot(jobId));
  }

  @GetMapping("/jobs/{jobId}/row-errors")
  public RowErrorsResponse getRowErrors(
      @PathVariable("jobId") UUID jobId,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return new RowErrorsResponse(jobId, jobService.rowErrors(jobId, limit));
  }

  @PostMapping("/products/bulk-delete")
  public ResponseEntity<JobAcceptedResponse> bulkDelete() {
    final JobRecord job = jobService.startBulkDelete();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new JobAcceptedResponse(
                job.jobId(), JobStatus.QUEUED.value(), "Bulk delete queued"));
  }
}
