/*
 * どこで: Importer NATS 基盤
 * 何を: ジョブ用 stream と dead-letter 用 stream、キューごとの durable pull consumer を用意する
 * なぜ: publisher と consumer が起動順に関係なく同じ stream 設定を前提にできるようにするため
 */
package com.example.importer.nats;

import com.example.importer.config.JobQueueProperties;
import com.example.importer.model.JobQueue;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JobStreamManager {

    private static final Logger logger = LoggerFactory.getLogger(JobStreamManager.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final JetStreamManagement jetStreamManagement;
    private final JobQueueProperties properties;
    private final AtomicBoolean ensured;

    public JobStreamManager(JetStreamManagement jetStreamManagement, JobQueueProperties properties) {
        this.jetStreamManagement = jetStreamManagement;
        this.properties = properties;
        this.ensured = new AtomicBoolean(false);
    }

    @PostConstruct
    public void ensureStreams() {
        if (!ensured.compareAndSet(false, true)) {
            return;
        }
        try {
            List<String> subjects = Arrays.stream(JobQueue.values())
                    .map(properties::subject)
                    .toList();
            // max-age がメッセージ TTL、duplicate-window が jobId による重複排除の窓
            upsertStream(StreamConfiguration.builder()
                    .name(properties.stream())
                    .subjects(subjects)
                    .maxAge(properties.maxAge())
                    .duplicateWindow(properties.duplicateWindow())
                    .build());
            upsertStream(StreamConfiguration.builder()
                    .name(properties.deadLetterStream())
                    .subjects(properties.subjectPrefix() + ".dead.>")
                    .maxAge(properties.deadLetterMaxAge())
                    .build());
            for (JobQueue queue : JobQueue.values()) {
                ensureConsumer(queue);
            }
            logger.info("job streams ensured stream={} deadLetterStream={} subjects={}",
                    properties.stream(),
                    properties.deadLetterStream(),
                    subjects);
        } catch (IOException | JetStreamApiException ex) {
            ensured.set(false);
            throw new IllegalStateException("failed to ensure job streams", ex);
        }
    }

    private void ensureConsumer(JobQueue queue) throws IOException, JetStreamApiException {
        int concurrency = properties.concurrency(queue);
        if (concurrency <= 0) {
            return;
        }
        ConsumerConfiguration configuration = ConsumerConfiguration.builder()
                .durable(properties.durable(queue))
                .filterSubject(properties.subject(queue))
                .ackPolicy(AckPolicy.Explicit)
                // ack-wait を超えて in-progress が来なければ再配信する
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                // 未 ack を並列数までに抑え、1 ワーカー 1 タスクにする
                .maxAckPending(concurrency)
                .build();
        jetStreamManagement.addOrUpdateConsumer(properties.stream(), configuration);
    }

    /** stream が無ければ作成し、あれば設定を更新する。 */
    void upsertStream(StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }
}
