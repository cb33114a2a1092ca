/*
 * どこで: Importer NATS 購読
 * 何を: MaxDeliver advisory を購読し、再配信上限に達したタスクを DLQ へ退避して FAILED にする
 * なぜ: ワーカーが異常終了し続けて自前のリトライ判定に届かなかったタスクも終端させるため
 */
package com.example.importer.nats;

import com.example.importer.config.JobAdvisoryProperties;
import com.example.importer.config.JobQueueProperties;
import com.example.importer.model.JobTask;
import com.example.importer.worker.JobOutcomeService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.MessageInfo;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnExpression("${nats.enabled:true} and ${importer.advisory.enabled:true}")
public class JobMaxDeliverAdvisorySubscriber {

    private static final Logger logger = LoggerFactory.getLogger(JobMaxDeliverAdvisorySubscriber.class);
    static final String MAX_DELIVERIES_ERROR = "Max deliveries exceeded";

    private final Connection connection;
    private final JetStreamManagement jetStreamManagement;
    private final JobStreamManager streamManager;
    private final JobQueueProperties queueProperties;
    private final JobAdvisoryProperties advisoryProperties;
    private final JobOutcomeService outcomeService;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public JobMaxDeliverAdvisorySubscriber(Connection connection,
            JetStreamManagement jetStreamManagement,
            JobStreamManager streamManager,
            JobQueueProperties queueProperties,
            JobAdvisoryProperties advisoryProperties,
            JobOutcomeService outcomeService,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.jetStreamManagement = jetStreamManagement;
        this.streamManager = streamManager;
        this.queueProperties = queueProperties;
        this.advisoryProperties = advisoryProperties;
        this.outcomeService = outcomeService;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    advisoryProperties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("job advisory subscriber started subject={} stream={} durable={}",
                    advisoryProperties.subject(),
                    advisoryProperties.stream(),
                    advisoryProperties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream advisory subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            JsonNode payload = objectMapper.readTree(message.getData());
            OptionalLong streamSeq = longField(payload, "stream_seq");
            if (streamSeq.isEmpty()) {
                // stream_seq が取れない advisory は再処理に使えないため破棄する
                logger.warn("advisory payload missing stream_seq subject={}", advisoryProperties.subject());
                ackSilently(message);
                return;
            }
            int deliveries = (int) longField(payload, "deliveries").orElse(queueProperties.maxDeliver());
            JobTask task = loadTask(streamSeq.getAsLong());
            if (task == null) {
                ackSilently(message);
                return;
            }
            outcomeService.deadLettered(task, null, MAX_DELIVERIES_ERROR, deliveries, streamSeq.getAsLong());
            message.ack();
        } catch (IOException ex) {
            // 不正 JSON は再配信しても回復しないため ack で破棄する
            logger.warn("failed to parse advisory payload subject={}", advisoryProperties.subject(), ex);
            ackSilently(message);
        } catch (DataAccessException ex) {
            // DB 障害は復旧後に再処理できるよう nak で再配信させる
            logger.warn("temporary failure while handling advisory payload subject={}",
                    advisoryProperties.subject(), ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            logger.warn("failed to handle advisory payload subject={}", advisoryProperties.subject(), ex);
            nakSilently(message);
        }
    }

    private JobTask loadTask(long streamSeq) throws IOException {
        MessageInfo info;
        try {
            info = jetStreamManagement.getMessage(queueProperties.stream(), streamSeq);
        } catch (JetStreamApiException ex) {
            // max-age で消えたメッセージは復元できない
            logger.warn("advisory target message not found stream={} seq={}",
                    queueProperties.stream(), streamSeq, ex);
            return null;
        }
        JobTask task = objectMapper.readValue(info.getData(), JobTask.class);
        if (task.jobId() == null || task.kind() == null) {
            logger.warn("advisory target is not a job task seq={}", streamSeq);
            return null;
        }
        return task;
    }

    private OptionalLong longField(JsonNode payload, String name) {
        JsonNode node = payload.get(name);
        if (node == null || !node.canConvertToLong() || node.asLong() <= 0L) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(node.asLong());
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // advisory は JetStream が発行する通常メッセージなので、専用 stream に溜めて durable で読む
        streamManager.upsertStream(StreamConfiguration.builder()
                .name(advisoryProperties.stream())
                .subjects(advisoryProperties.subject())
                .build());
        logger.info("job advisory stream ensured stream={} subject={}",
                advisoryProperties.stream(),
                advisoryProperties.subject());
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(queueProperties.ackWait())
                .maxDeliver(queueProperties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(advisoryProperties.stream())
                .durable(advisoryProperties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack advisory message", ex);
        }
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack advisory message", ex);
        }
    }
}
