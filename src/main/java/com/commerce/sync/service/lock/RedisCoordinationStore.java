package com.commerce.sync.service.lock;

import com.commerce.sync.exception.CoordinationStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed coordination store.
 * <p>
 * Leases use {@code SET key value NX PX ttl}; compare-and-delete runs as a Lua script so the
 * check and the delete happen in one atomic step. The Lettuce command timeout bounds every call.
 */
@Slf4j
public class RedisCoordinationStore implements CoordinationStore {

    private static final RedisScript<Long> DELETE_IF_MATCHES = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisCoordinationStore(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            Boolean created = stringRedisTemplate.opsForValue().setIfAbsent(key, value, ttl);
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException e) {
            throw new CoordinationStoreException("SET NX failed for key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CoordinationStoreException("DEL failed for key " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(stringRedisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            throw new CoordinationStoreException("EXISTS failed for key " + key, e);
        }
    }

    @Override
    public boolean deleteIfMatches(String key, String expectedValue) {
        try {
            Long deleted = stringRedisTemplate.execute(DELETE_IF_MATCHES, List.of(key), expectedValue);
            return deleted != null && deleted > 0;
        } catch (DataAccessException e) {
            throw new CoordinationStoreException("Compare-and-delete failed for key " + key, e);
        }
    }
}
