package com.roadside.request.service;

import com.roadside.request.entity.RequestChange;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.RequestException;
import com.roadside.request.repository.ServiceRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-writer core of the lifecycle: load, mutate, save and broadcast one
 * request under its lock. Nothing else saves a {@link ServiceRequest}.
 *
 * A mutation that throws leaves the row untouched and broadcasts nothing.
 * A mutation that records no change is not saved. Side effects outside the
 * database (polling, matching sessions) are registered with
 * {@link #afterCommit} or {@link #onCompletion} so a rolled-back mutation
 * leaves them as they were.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestStateMachine {

    private final ServiceRequestRepository repository;
    private final RequestLockTemplate lockTemplate;
    private final RequestEventPublisher eventPublisher;

    public <T> T mutate(UUID requestId, Function<ServiceRequest, T> mutation) {
        return lockTemplate.execute(requestId, () -> {
            ServiceRequest request = load(requestId);
            T result = mutation.apply(request);
            commit(request);
            return result;
        });
    }

    /** Inserts a freshly opened request and applies its first mutation (normally IDLE -> SEARCHING). */
    public ServiceRequest insert(ServiceRequest request, Function<ServiceRequest, ServiceRequest> firstMutation) {
        return lockTemplate.execute(request.getId(), () -> {
            ServiceRequest mutated = firstMutation.apply(request);
            commit(mutated);
            return mutated;
        });
    }

    /**
     * Runs {@code action} under the provider's lock. Mutations made inside it
     * take their request lock after the provider's, never the other way round.
     */
    public <T> T withProviderLock(String providerId, Supplier<T> action) {
        return lockTemplate.executeForProvider(providerId, action);
    }

    /** Runs {@code action} once the current mutation commits, or right away outside a transaction. */
    public void afterCommit(Runnable action) {
        onCompletion(action, null);
    }

    /**
     * Runs {@code committed} after a commit and {@code rolledBack} (if any) after
     * a rollback. Both run before the request lock is released.
     */
    public void onCompletion(Runnable committed, Runnable rolledBack) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            committed.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    committed.run();
                } else if (rolledBack != null) {
                    rolledBack.run();
                }
            }
        });
    }

    public ServiceRequest load(UUID requestId) {
        return repository.findById(requestId)
                .orElseThrow(() -> new RequestException(RequestException.REQUEST_NOT_FOUND,
                        "Request " + requestId + " not found"));
    }

    private void commit(ServiceRequest request) {
        if (!request.hasPendingChanges()) {
            return;
        }
        List<RequestChange> changes = request.drainChanges();
        repository.save(request);
        for (RequestChange change : changes) {
            if (change.isTransition()) {
                log.info("Request {} {} -> {}{}", request.getId(), change.from(), change.to(),
                        change.reason() != null ? " (" + change.reason() + ")" : "");
            } else {
                log.debug("Request {} updated in {} ({})", request.getId(), change.to(), change.reason());
            }
            eventPublisher.publishChange(request, change);
        }
    }
}
