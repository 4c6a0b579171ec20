package com.yescount.planner.infrastructure.adapter.lock;

import com.yescount.planner.domain.port.out.IngestionLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@code SET NX} lock with a TTL so a crashed holder cannot block ingestion forever.
 * If Redis itself is unreachable the run proceeds unlocked.
 */
@Repository
public class RedisIngestionLock implements IngestionLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisIngestionLock.class);

    static final String LOCK_KEY = "yescount:ingestion:lock";

    private final StringRedisTemplate redisTemplate;
    private final AtomicReference<String> heldToken = new AtomicReference<>();

    public RedisIngestionLock(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean tryAcquire(Duration ttl) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                heldToken.set(token);
                logger.debug("Acquired ingestion lock for {}", ttl);
                return true;
            }
            logger.debug("Ingestion lock held by another process");
            return false;
        } catch (Exception e) {
            logger.warn("Redis unavailable, running ingestion without lock: {}", e.getMessage());
            return true;
        }
    }

    @Override
    public void release() {
        String token = heldToken.getAndSet(null);
        if (token == null) {
            return;
        }
        try {
            if (token.equals(redisTemplate.opsForValue().get(LOCK_KEY))) {
                redisTemplate.delete(LOCK_KEY);
                logger.debug("Released ingestion lock");
            }
        } catch (Exception e) {
            logger.error("Failed to release ingestion lock, it expires with its TTL", e);
        }
    }
}
