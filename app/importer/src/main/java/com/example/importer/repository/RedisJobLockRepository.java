package com.example.importer.repository;

import com.example.importer.config.ProgressProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Repository;

/** 同一ジョブのタスクが並行実行されないよう Redis SET NX でロックする。 */
@Repository
public class RedisJobLockRepository {

  // 自分が取ったロックだけを外す
  private static final DefaultRedisScript<Long> RELEASE_SCRIPT =
      new DefaultRedisScript<>(
          "if redis.call('get', KEYS[1]) == ARGV[1] then "
              + "return redis.call('del', KEYS[1]) else return 0 end",
          Long.class);

  // 自分が持っているロックだけ TTL を延ばす
  private static final DefaultRedisScript<Long> RENEW_SCRIPT =
      new DefaultRedisScript<>(
          "if redis.call('get', KEYS[1]) == ARGV[1] then "
              + "return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
          Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ProgressProperties properties;

  public RedisJobLockRepository(StringRedisTemplate redisTemplate, ProgressProperties properties) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
  }

  public boolean tryAcquire(UUID jobId, String owner, Duration ttl) {
    final Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey(jobId), owner, ttl);
    return Boolean.TRUE.equals(acquired);
  }

  public boolean release(UUID jobId, String owner) {
    final Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey(jobId)), owner);
    return released != null && released > 0L;
  }

  /** 保持中のロックの TTL を延長する。ロックを失っていれば false。 */
  public boolean renew(UUID jobId, String owner, Duration ttl) {
    final Long renewed =
        redisTemplate.execute(
            RENEW_SCRIPT, List.of(lockKey(jobId)), owner, Long.toString(ttl.toMillis()));
    return renewed != null && renewed > 0L;
  }

  /** ロックの残り TTL。ロックが無ければ {@link Duration#ZERO}。 */
  public Duration remainingTtl(UUID jobId) {
    final Long millis = redisTemplate.getExpire(lockKey(jobId), TimeUnit.MILLISECONDS);
    return millis == null || millis <= 0L ? Duration.ZERO : Duration.ofMillis(millis);
  }

  /**
   * ロック待ちで差し戻した配信の回数を数える。
   *
   * <p>JetStream の配信回数からこれを引いたものが実際の実行試行回数になる。
   */
  public long recordLockedDelivery(UUID jobId, Duration ttl) {
    final String key = lockedDeliveriesKey(jobId);
    final Long count = redisTemplate.opsForValue().increment(key);
    redisTemplate.expire(key, ttl);
    return count == null ? 0L : count;
  }

  public long lockedDeliveries(UUID jobId) {
    final String value = redisTemplate.opsForValue().get(lockedDeliveriesKey(jobId));
    return value == null ? 0L : Long.parseLong(value);
  }

  String lockKey(UUID jobId) {
    return properties.lockKeyPrefix() + ":" + jobId;
  }

  String lockedDeliveriesKey(UUID jobId) {
    return properties.lockKeyPrefix() + ":locked:" + jobId;
  }
}
