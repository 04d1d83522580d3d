package com.whereq.helios.store;

import com.whereq.helios.config.HeliosProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Redis-backed shared state store.
 * Compare-and-swap runs as a Lua script so the read-compare-write happens atomically on the server.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "helios.store", name = "type", havingValue = "redis")
public class RedisSharedStateStore implements SharedStateStore {

    private static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of("""
        local current = redis.call('GET', KEYS[1])
        if ARGV[4] == '1' then
          if current then return 0 end
        else
          if current ~= ARGV[1] then return 0 end
        end
        if tonumber(ARGV[3]) > 0 then
          redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
        else
          redis.call('SET', KEYS[1], ARGV[2])
        end
        return 1
        """, Long.class);

    private static final long SCAN_BATCH = 500;

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    private final String keyPrefix;

    public RedisSharedStateStore(@Qualifier("heliosRedisTemplate") ReactiveRedisTemplate<String, String> heliosRedisTemplate,
                                 HeliosProperties properties) {
        this.redisTemplate = heliosRedisTemplate;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        log.info("Using Redis shared state store (prefix={})", keyPrefix);
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(keyPrefix + key);
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        if (ttl == null) {
            return redisTemplate.opsForValue().set(keyPrefix + key, value);
        }
        return redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
    }

    @Override
    public Mono<Boolean> compareAndSet(String key, String expected, String newValue, Duration ttl) {
        List<String> args = List.of(
            expected == null ? "" : expected,
            newValue,
            String.valueOf(ttl == null ? 0 : ttl.toMillis()),
            expected == null ? "1" : "0");

        return redisTemplate.execute(COMPARE_AND_SET, List.of(keyPrefix + key), args)
            .next()
            .map(result -> result == 1L)
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Long> delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Mono.just(0L);
        }
        String[] prefixed = keys.stream().map(k -> keyPrefix + k).toArray(String[]::new);
        return redisTemplate.delete(prefixed)
            .doOnSuccess(deleted -> log.debug("Deleted {} keys", deleted));
    }

    @Override
    public Flux<String> keys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(escapeGlob(keyPrefix + prefix) + "*")
            .count(SCAN_BATCH)
            .build();

        return redisTemplate.scan(options)
            .map(key -> key.substring(keyPrefix.length()));
    }

    @Override
    public Mono<Boolean> ping() {
        return redisTemplate.execute(connection -> connection.ping())
            .next()
            .map("PONG"::equalsIgnoreCase)
            .onErrorResume(e -> {
                log.warn("Redis ping failed: {}", e.getMessage());
                return Mono.just(false);
            });
    }

    private static String escapeGlob(String pattern) {
        StringBuilder escaped = new StringBuilder(pattern.length());
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
