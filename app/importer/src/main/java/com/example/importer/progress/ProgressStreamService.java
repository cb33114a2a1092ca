/*
 * どこで: Importer 進捗配信
 * 何を: ジョブ進捗を SSE で流す。保存済みスナップショットを先に送り、以後はトピックの更新を転送する
 * なぜ: 途中から接続したクライアントも最新状態から追従でき、終端で接続を閉じられるようにするため
 *       進捗が止まっている間も heartbeat コメントを送り、切断済みクライアントの購読を解放する
 */
package com.example.importer.progress;

import com.example.importer.config.ProgressProperties;
import com.example.importer.job.JobNotFoundException;
import com.example.importer.model.JobStatus;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.repository.JobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Service
@RequiredArgsConstructor
public class ProgressStreamService {

  private static final Logger logger = LoggerFactory.getLogger(ProgressStreamService.class);

  private final JobRepository jobRepository;
  private final ProgressStore progressStore;
  private final ProgressProperties properties;
  private final ObjectMapper objectMapper;
  private final Set<ProgressStream> activeStreams = ConcurrentHashMap.newKeySet();

  /** @throws JobNotFoundException 未登録のジョブ */
  public SseEmitter open(UUID jobId) {
    if (jobRepository.findById(jobId).isEmpty()) {
      throw new JobNotFoundException(jobId);
    }
    final SseEmitter emitter = new SseEmitter(properties.streamTimeout().toMillis());
    final ProgressStream stream = new ProgressStream(jobId, emitter);
    activeStreams.add(stream);
    emitter.onCompletion(stream::close);
    emitter.onTimeout(stream::close);
    emitter.onError(ex -> stream.close());
    // 先に購読してから読むことで、スナップショットと購読開始の間の更新を取りこぼさない
    stream.attach(progressStore.subscribe(jobId, stream::forward));
    final Optional<ProgressSnapshot> snapshot = progressStore.getProgress(jobId);
    if (snapshot.isEmpty()) {
      logger.info("progress snapshot expired jobId={}", jobId);
      stream.finish();
      return emitter;
    }
    stream.sendSnapshot(snapshot.get());
    return emitter;
  }

  /** 開いている全ストリームに SSE コメントを送る。送れなかったストリームは閉じる。 */
  @Scheduled(fixedDelayString = "${importer.progress.heartbeat-interval}")
  public void sendHeartbeats() {
    for (ProgressStream stream : activeStreams) {
      stream.heartbeat();
    }
  }

  @VisibleForTesting
  int activeStreamCount() {
    return activeStreams.size();
  }

  @VisibleForTesting
  final class ProgressStream {

    private final UUID jobId;
    private final SseEmitter emitter;
    private final AtomicReference<ProgressSubscription> subscription = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ProgressStream(UUID jobId, SseEmitter emitter) {
      this.jobId = jobId;
      this.emitter = emitter;
    }

    void attach(ProgressSubscription value) {
      subscription.set(value);
      if (closed.get()) {
        release();
      }
    }

    void sendSnapshot(ProgressSnapshot snapshot) {
      try {
        send(objectMapper.writeValueAsString(snapshot.toPayload(jobId)));
      } catch (JsonProcessingException ex) {
        throw new IllegalStateException("failed to serialize progress snapshot jobId=" + jobId, ex);
      }
      if (snapshot.isTerminal()) {
        finish();
      }
    }

    void forward(String payloadJson) {
      if (closed.get()) {
        return;
      }
      send(payloadJson);
      if (isTerminal(payloadJson)) {
        finish();
      }
    }

    void finish() {
      if (closed.get()) {
        return;
      }
      final Map<String, Object> closeEvent = new LinkedHashMap<>();
      closeEvent.put("event", "close");
      closeEvent.put("job_id", jobId.toString());
      try {
        send(objectMapper.writeValueAsString(closeEvent));
      } catch (JsonProcessingException ex) {
        throw new IllegalStateException("failed to serialize close event", ex);
      }
      close();
      emitter.complete();
    }

    void heartbeat() {
      if (closed.get()) {
        return;
      }
      sendEvent(SseEmitter.event().comment("heartbeat"));
    }

    void close() {
      if (closed.compareAndSet(false, true)) {
        activeStreams.remove(this);
        release();
      }
    }

    private void release() {
      final ProgressSubscription current = subscription.getAndSet(null);
      if (current != null) {
        current.close();
      }
    }

    private void send(String payloadJson) {
      sendEvent(SseEmitter.event().data(payloadJson, MediaType.APPLICATION_JSON));
    }

    private void sendEvent(SseEmitter.SseEventBuilder event) {
      try {
        emitter.send(event);
      } catch (IOException | IllegalStateException ex) {
        // クライアント切断は購読だけを閉じる。ジョブには影響させない
        logger.debug("progress stream closed by client jobId={}", jobId, ex);
        close();
      }
    }

    private boolean isTerminal(String payloadJson) {
      try {
        final JsonNode status = objectMapper.readTree(payloadJson).get("status");
        return status != null
            && status.isTextual()
            && JobStatus.fromValue(status.asText()).isTerminal();
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        logger.warn("unparseable progress update jobId={}", jobId, ex);
        return false;
      }
    }
  }
}
