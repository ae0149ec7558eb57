package com.roadside.request.service;

import com.roadside.request.config.LifecycleProperties;
import com.roadside.request.exception.RequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serialises every mutation of one request across all nodes: a Redisson lock
 * per request id, with the database transaction opened inside the lock so it
 * commits before the next writer gets in.
 *
 * A second, per-provider lock guards rules that span requests (a provider
 * holds at most one active request). It is always taken before the request
 * lock, never inside it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestLockTemplate {

    private static final String LOCK_PREFIX = "lock:request:";
    private static final String PROVIDER_LOCK_PREFIX = "lock:provider:";

    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;
    private final LifecycleProperties properties;

    public <T> T execute(UUID requestId, Supplier<T> action) {
        return withLock(LOCK_PREFIX + requestId, "requestId", requestId.toString(), "request",
                () -> transactionTemplate.execute(status -> action.get()));
    }

    /** Holds the provider's lock around {@code action}, which may in turn lock requests. */
    public <T> T executeForProvider(String providerId, Supplier<T> action) {
        return withLock(PROVIDER_LOCK_PREFIX + providerId, "providerId", providerId, "provider", action);
    }

    private <T> T withLock(String key, String mdcKey, String id, String kind, Supplier<T> action) {
        RLock lock = redissonClient.getLock(key);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(mdcKey, id)) {
            boolean acquired = lock.tryLock(properties.getLockWait().toMillis(),
                    properties.getLockLease().toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Could not acquire lock for {} {} within {}", kind, id, properties.getLockWait());
                throw new RequestException(RequestException.REQUEST_BUSY,
                        "The " + kind + " " + id + " is being updated, try again");
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException(RequestException.REQUEST_BUSY,
                    "Interrupted while waiting for " + kind + " " + id, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
