/*
 * どこで: Importer NATS 基盤
 * 何を: JobTask を JSON で JetStream へ publish する
 * なぜ: Nats-Msg-Id にジョブ ID を使い、二重投入でも 1 ジョブ 1 メッセージに保つため
 */
package com.example.importer.nats;

import com.example.importer.config.JobQueueProperties;
import com.example.importer.model.JobQueue;
import com.example.importer.model.JobTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsJobTaskPublisher implements JobTaskPublisher {

    private static final Logger logger = LoggerFactory.getLogger(NatsJobTaskPublisher.class);
    static final String MSG_ID_HEADER = "Nats-Msg-Id";
    static final String ERROR_HEADER = "Job-Error";
    private static final int ERROR_HEADER_MAX_LENGTH = 256;

    private final JetStream jetStream;
    private final JobQueueProperties properties;
    private final ObjectMapper objectMapper;

    public NatsJobTaskPublisher(JetStream jetStream,
            JobQueueProperties properties,
            ObjectMapper objectMapper,
            JobStreamManager streamManager) {
        this.jetStream = jetStream;
        this.properties = properties;
        this.objectMapper = objectMapper;
        // publish 前に stream が存在することを保証する
        streamManager.ensureStreams();
    }

    @Override
    public void publish(JobTask task) {
        JobQueue queue = properties.route(task.kind());
        Headers headers = new Headers();
        headers.add(MSG_ID_HEADER, task.jobId().toString());
        PublishAck ack = send(properties.subject(queue), headers, task);
        if (ack.isDuplicate()) {
            logger.info("job task already enqueued jobId={} queue={}", task.jobId(), queue.value());
            return;
        }
        logger.info("job task enqueued jobId={} kind={} queue={} seq={}",
                task.jobId(), task.kind(), queue.value(), ack.getSeqno());
    }

    @Override
    public void publishDeadLetter(JobTask task, JobQueue queue, String errorMessage) {
        Headers headers = new Headers();
        headers.add(MSG_ID_HEADER, "dead-" + task.jobId());
        headers.add(ERROR_HEADER, headerSafe(errorMessage));
        send(properties.deadLetterSubject(queue), headers, task);
    }

    private PublishAck send(String subject, Headers headers, JobTask task) {
        try {
            return jetStream.publish(subject, headers, objectMapper.writeValueAsBytes(task));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("job task is not serializable jobId=" + task.jobId(), ex);
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to publish job task subject=" + subject, ex);
        }
    }

    private String headerSafe(String value) {
        if (value == null) {
            return "unknown error";
        }
        String singleLine = value.replaceAll("[\\r\\n]+", " ");
        return singleLine.length() <= ERROR_HEADER_MAX_LENGTH
                ? singleLine
                : singleLine.substring(0, ERROR_HEADER_MAX_LENGTH);
    }
}
