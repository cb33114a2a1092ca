/*
 * どこで: Importer NATS 購読
 * 何を: キューごとの durable pull consumer から 1 件ずつ取り出してワーカーへ渡す
 * なぜ: prefetch 1 で長時間ジョブを 1 ワーカー 1 タスクに限定し、取りこぼしを ack 制御に任せるため
 */
package com.example.importer.nats;

import com.example.importer.config.JobQueueProperties;
import com.example.importer.model.JobQueue;
import com.example.importer.worker.JobTaskHandler;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JobQueueConsumer {

    private static final Logger logger = LoggerFactory.getLogger(JobQueueConsumer.class);

    private final JetStream jetStream;
    private final JobStreamManager streamManager;
    private final JobTaskHandler handler;
    private final JobQueueProperties properties;
    private final AtomicBoolean running;
    private final List<JetStreamSubscription> subscriptions;
    private ExecutorService executor;

    public JobQueueConsumer(JetStream jetStream,
            JobStreamManager streamManager,
            JobTaskHandler handler,
            JobQueueProperties properties) {
        this.jetStream = jetStream;
        this.streamManager = streamManager;
        this.handler = handler;
        this.properties = properties;
        this.running = new AtomicBoolean(false);
        this.subscriptions = new ArrayList<>();
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        streamManager.ensureStreams();
        int workers = 0;
        for (JobQueue queue : JobQueue.values()) {
            workers += properties.concurrency(queue);
        }
        if (workers == 0) {
            logger.info("job queue consumer disabled; no queue has workers");
            return;
        }
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            for (JobQueue queue : JobQueue.values()) {
                for (int i = 0; i < properties.concurrency(queue); i++) {
                    JetStreamSubscription subscription = jetStream.subscribe(
                            properties.subject(queue),
                            PullSubscribeOptions.bind(properties.stream(), properties.durable(queue)));
                    subscriptions.add(subscription);
                    executor.execute(() -> pollLoop(queue, subscription));
                }
                logger.info("job queue consumer started queue={} subject={} durable={} concurrency={}",
                        queue.value(),
                        properties.subject(queue),
                        properties.durable(queue),
                        properties.concurrency(queue));
            }
        } catch (IOException | JetStreamApiException ex) {
            stop();
            throw new IllegalStateException("failed to start job queue consumer", ex);
        }
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        for (JetStreamSubscription subscription : subscriptions) {
            try {
                subscription.unsubscribe();
            } catch (IllegalStateException ex) {
                logger.warn("failed to unsubscribe job queue consumer", ex);
            }
        }
        subscriptions.clear();
        if (executor != null) {
            executor.shutdown();
            try {
                // 実行中のタスクは ack されずに ack-wait 後に再配信される
                if (!executor.awaitTermination(properties.fetchTimeout().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            executor = null;
        }
    }

    private void pollLoop(JobQueue queue, JetStreamSubscription subscription) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce(subscription);
            } catch (IllegalStateException ex) {
                if (!running.get()) {
                    return;
                }
                logger.warn("job queue fetch failed queue={}", queue.value(), ex);
                sleepQuietly(properties.fetchTimeout().toMillis());
            }
        }
    }

    @VisibleForTesting
    int pollOnce(JetStreamSubscription subscription) {
        // prefetch 1: 処理が終わるまで次のタスクを取りに行かない
        List<Message> messages = subscription.fetch(1, properties.fetchTimeout());
        for (Message message : messages) {
            try {
                handler.handle(message);
            } catch (RuntimeException ex) {
                // ack していないため ack-wait 経過後に再配信される
                logger.error("unhandled failure in job task handler subject={}", message.getSubject(), ex);
            }
        }
        return messages.size();
    }

    private void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
