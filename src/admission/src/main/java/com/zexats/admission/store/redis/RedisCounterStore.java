package com.zexats.admission.store.redis;

import com.zexats.admission.store.CounterStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed counters shared by every instance of the service.
 *
 * <p>Increment and expiry run in one Lua script so concurrent callers never lose an update and
 * a counter never outlives its window without a TTL.
 */
public class RedisCounterStore implements CounterStore {
  private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);
  private static final long SCAN_COUNT = 500L;

  private static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
      """
      local value = redis.call('INCR', KEYS[1])
      redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))
      return value
      """,
      Long.class);

  private final StringRedisTemplate redisTemplate;

  public RedisCounterStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public long increment(String key, Duration window) {
    long ttlSeconds = Math.max(1L, window.toSeconds());
    Long value = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(ttlSeconds));
    return value == null ? 0L : value;
  }

  @Override
  public long peek(String key) {
    return parseCount(redisTemplate.opsForValue().get(key));
  }

  @Override
  public void deleteByPrefix(String prefix) {
    ScanOptions options = ScanOptions.scanOptions()
        .match(RedisKeyPatterns.prefixPattern(prefix))
        .count(SCAN_COUNT)
        .build();
    List<String> batch = new ArrayList<>();
    long deleted = 0L;
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        batch.add(cursor.next());
        if (batch.size() >= SCAN_COUNT) {
          deleted += deleteBatch(batch);
        }
      }
    }
    deleted += deleteBatch(batch);
    log.debug("Deleted {} Redis counters under {}", deleted, prefix);
  }

  @Override
  public String backendName() {
    return "redis";
  }

  @Override
  public boolean ping() {
    try {
      String reply = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      return "PONG".equalsIgnoreCase(reply);
    } catch (DataAccessException ex) {
      log.debug("Redis ping failed", ex);
      return false;
    }
  }

  private long deleteBatch(List<String> batch) {
    if (batch.isEmpty()) {
      return 0L;
    }
    Long removed = redisTemplate.delete(batch);
    batch.clear();
    return removed == null ? 0L : removed;
  }

  static long parseCount(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0L;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      log.warn("Ignoring non-numeric counter value '{}'", raw);
      return 0L;
    }
  }
}
