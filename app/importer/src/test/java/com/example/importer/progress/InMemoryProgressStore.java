package com.example.importer.progress;

import com.example.importer.model.ProgressSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** 保存と配信の履歴を残すテスト用ストア。 */
public class InMemoryProgressStore implements ProgressStore {

  private final Clock clock;
  private final Map<UUID, ProgressSnapshot> snapshots = new HashMap<>();
  private final Map<UUID, List<ProgressSnapshot>> history = new HashMap<>();
  private final Map<UUID, List<Map<String, Object>>> published = new HashMap<>();
  private final Map<UUID, List<Consumer<String>>> listeners = new HashMap<>();
  private RuntimeException publishFailure;

  public InMemoryProgressStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized Instant setProgress(UUID jobId, ProgressSnapshot snapshot) {
    final Instant now = Instant.now(clock);
    final ProgressSnapshot stored = snapshot.withUpdatedAt(now);
    snapshots.put(jobId, stored);
    history.computeIfAbsent(jobId, ignored -> new ArrayList<>()).add(stored);
    return now;
  }

  @Override
  public synchronized Optional<ProgressSnapshot> getProgress(UUID jobId) {
    return Optional.ofNullable(snapshots.get(jobId));
  }

  @Override
  public long publishUpdate(UUID jobId, Map<String, Object> delta) {
    final List<Consumer<String>> targets;
    synchronized (this) {
      if (publishFailure != null) {
        throw publishFailure;
      }
      published.computeIfAbsent(jobId, ignored -> new ArrayList<>()).add(new LinkedHashMap<>(delta));
      targets = List.copyOf(listeners.getOrDefault(jobId, List.of()));
    }
    for (Consumer<String> listener : targets) {
      listener.accept("{\"status\":\"" + delta.get("status") + "\"}");
    }
    return targets.size();
  }

  @Override
  public synchronized ProgressSubscription subscribe(UUID jobId, Consumer<String> listener) {
    listeners.computeIfAbsent(jobId, ignored -> new CopyOnWriteArrayList<>()).add(listener);
    return () -> removeListener(jobId, listener);
  }

  public synchronized void put(UUID jobId, ProgressSnapshot snapshot) {
    snapshots.put(jobId, snapshot);
  }

  public synchronized List<ProgressSnapshot> history(UUID jobId) {
    return List.copyOf(history.getOrDefault(jobId, List.of()));
  }

  public synchronized List<Map<String, Object>> published(UUID jobId) {
    return List.copyOf(published.getOrDefault(jobId, List.of()));
  }

  public synchronized int listenerCount(UUID jobId) {
    return listeners.getOrDefault(jobId, List.of()).size();
  }

  public synchronized void failPublishesWith(RuntimeException failure) {
    this.publishFailure = failure;
  }

  private synchronized void removeListener(UUID jobId, Consumer<String> listener) {
    final List<Consumer<String>> current = listeners.get(jobId);
    if (current != null) {
      current.remove(listener);
    }
  }
}
