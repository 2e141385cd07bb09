package com.zexats.admission.store.redis;

import com.zexats.admission.store.AdmissionKeys;
import com.zexats.admission.store.SlotRecord;
import com.zexats.admission.store.SlotStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed slot registry.
 *
 * <p>Slots live in a hash (id to owner) indexed by a sorted set of issue times. Acquire and
 * release are Lua scripts touching the hash, the index and the owner's counter together, so
 * {@code finish}, the sweep and admin resets can race without double-decrementing.
 */
public class RedisSlotStore implements SlotStore {
  private static final long SCAN_COUNT = 500L;

  private static final RedisScript<Long> ACQUIRE_SCRIPT = new DefaultRedisScript<>(
      """
      local active = tonumber(redis.call('GET', KEYS[1]) or '0')
      if active >= tonumber(ARGV[1]) then
        return 0
      end
      if redis.call('HSETNX', KEYS[2], ARGV[2], ARGV[3]) == 0 then
        return 0
      end
      redis.call('ZADD', KEYS[3], ARGV[4], ARGV[2])
      redis.call('INCR', KEYS[1])
      return 1
      """,
      Long.class);

  private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
      """
      local owner = redis.call('HGET', KEYS[2], ARGV[1])
      if not owner or owner ~= ARGV[2] then
        return 0
      end
      redis.call('HDEL', KEYS[2], ARGV[1])
      redis.call('ZREM', KEYS[3], ARGV[1])
      local active = tonumber(redis.call('GET', KEYS[1]) or '0')
      if active > 1 then
        redis.call('DECR', KEYS[1])
      else
        redis.call('DEL', KEYS[1])
      end
      return 1
      """,
      Long.class);

  private final StringRedisTemplate redisTemplate;
  private final AdmissionKeys keys;

  public RedisSlotStore(StringRedisTemplate redisTemplate, AdmissionKeys keys) {
    this.redisTemplate = redisTemplate;
    this.keys = keys;
  }

  @Override
  public boolean tryAcquire(SlotRecord slot, int maxConcurrent) {
    Long result = redisTemplate.execute(
        ACQUIRE_SCRIPT,
        List.of(keys.activeCounter(slot.userId()), keys.slots(), keys.slotsIssued()),
        String.valueOf(maxConcurrent),
        slot.analysisId(),
        slot.userId(),
        String.valueOf(slot.issuedAt().toEpochMilli()));
    return result != null && result == 1L;
  }

  @Override
  public boolean release(String userId, String analysisId) {
    Long result = redisTemplate.execute(
        RELEASE_SCRIPT,
        List.of(keys.activeCounter(userId), keys.slots(), keys.slotsIssued()),
        analysisId,
        userId);
    return result != null && result == 1L;
  }

  @Override
  public long activeCount(String userId) {
    return RedisCounterStore.parseCount(redisTemplate.opsForValue().get(keys.activeCounter(userId)));
  }

  @Override
  public List<SlotRecord> findIssuedBefore(Instant cutoff) {
    Set<TypedTuple<String>> issued = redisTemplate.opsForZSet().rangeByScoreWithScores(
        keys.slotsIssued(),
        Double.NEGATIVE_INFINITY,
        cutoff.toEpochMilli() - 1);
    if (issued == null || issued.isEmpty()) {
      return Collections.emptyList();
    }

    List<TypedTuple<String>> candidates = new ArrayList<>(issued);
    List<Object> ids = new ArrayList<>(candidates.size());
    for (TypedTuple<String> tuple : candidates) {
      ids.add(tuple.getValue());
    }
    List<Object> owners = redisTemplate.opsForHash().multiGet(keys.slots(), ids);

    List<SlotRecord> stale = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      Object owner = owners == null ? null : owners.get(i);
      Double score = candidates.get(i).getScore();
      if (owner == null || score == null) {
        // Released between the index read and the owner lookup.
        continue;
      }
      stale.add(new SlotRecord(
          candidates.get(i).getValue(),
          owner.toString(),
          Instant.ofEpochMilli(score.longValue())));
    }
    return stale;
  }

  @Override
  public int releaseAll(String userId) {
    List<String> owned = new ArrayList<>();
    ScanOptions options = ScanOptions.scanOptions().count(SCAN_COUNT).build();
    try (Cursor<Entry<Object, Object>> cursor = redisTemplate.opsForHash().scan(keys.slots(), options)) {
      while (cursor.hasNext()) {
        Entry<Object, Object> entry = cursor.next();
        if (userId.equals(String.valueOf(entry.getValue()))) {
          owned.add(String.valueOf(entry.getKey()));
        }
      }
    }

    int released = 0;
    for (String analysisId : owned) {
      if (release(userId, analysisId)) {
        released++;
      }
    }
    redisTemplate.delete(keys.activeCounter(userId));
    return released;
  }
}
