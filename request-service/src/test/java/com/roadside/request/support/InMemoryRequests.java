package com.roadside.request.support;

import com.roadside.request.config.LifecycleProperties;
import com.roadside.request.entity.PaymentAttempt;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.repository.PaymentAttemptRepository;
import com.roadside.request.repository.ServiceRequestRepository;
import com.roadside.request.service.RequestEventPublisher;
import com.roadside.request.service.RequestLockTemplate;
import com.roadside.request.service.RequestStateMachine;
import com.roadside.shared.enums.RequestStatus;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEFAULTS;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Wires a {@link RequestStateMachine} over in-memory repositories, Redisson
 * locks backed by one real {@link ReentrantLock} per key and an
 * {@link InMemoryTransactionManager}.
 */
public class InMemoryRequests {

    public final Map<UUID, ServiceRequest> requests = new ConcurrentHashMap<>();
    public final Map<UUID, PaymentAttempt> attempts = new ConcurrentHashMap<>();
    public final ServiceRequestRepository requestRepository = mock(ServiceRequestRepository.class);
    public final PaymentAttemptRepository attemptRepository = mock(PaymentAttemptRepository.class);
    public final InMemoryTransactionManager transactionManager = new InMemoryTransactionManager();
    public final RequestLockTemplate lockTemplate;

    public InMemoryRequests() {
        lenient().when(requestRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(requests.get(inv.<UUID>getArgument(0))));
        lenient().when(requestRepository.save(any(ServiceRequest.class))).thenAnswer(inv -> {
            ServiceRequest request = inv.getArgument(0);
            requests.put(request.getId(), request);
            return request;
        });
        lenient().when(requestRepository.findByIdempotencyKey(anyString())).thenAnswer(inv -> requests.values().stream()
                .filter(r -> inv.getArgument(0).equals(r.getIdempotencyKey()))
                .findFirst());
        lenient().when(requestRepository.existsByClientIdAndStatusIn(anyString(), anyCollection())).thenAnswer(inv -> {
            Collection<RequestStatus> statuses = inv.getArgument(1);
            return requests.values().stream()
                    .anyMatch(r -> r.getClientId().equals(inv.getArgument(0)) && statuses.contains(r.getStatus()));
        });
        lenient().when(requestRepository.existsByProviderIdAndStatusIn(anyString(), anyCollection())).thenAnswer(inv -> {
            Collection<RequestStatus> statuses = inv.getArgument(1);
            return requests.values().stream()
                    .anyMatch(r -> inv.getArgument(0).equals(r.getProviderId()) && statuses.contains(r.getStatus()));
        });
        lenient().when(requestRepository.findByStatusAndProviderFinishRequestedAtBefore(any(), any())).thenAnswer(inv -> {
            RequestStatus status = inv.getArgument(0);
            Instant cutoff = inv.getArgument(1);
            return requests.values().stream()
                    .filter(r -> r.getStatus() == status && r.getProviderFinishRequestedAt() != null
                            && r.getProviderFinishRequestedAt().isBefore(cutoff))
                    .toList();
        });

        lenient().when(attemptRepository.save(any(PaymentAttempt.class))).thenAnswer(inv -> {
            PaymentAttempt attempt = inv.getArgument(0);
            if (attempt.getId() == null) {
                attempt.setId(UUID.randomUUID());
            }
            attempts.put(attempt.getId(), attempt);
            return attempt;
        });
        lenient().when(attemptRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(attempts.get(inv.<UUID>getArgument(0))));
        lenient().when(attemptRepository.findByRequestIdOrderByAttemptNumberAsc(any())).thenAnswer(inv -> attempts.values().stream()
                .filter(a -> a.getRequestId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparingInt(PaymentAttempt::getAttemptNumber))
                .toList());
        lenient().when(attemptRepository.findByGatewayIntentId(anyString())).thenAnswer(inv -> attempts.values().stream()
                .filter(a -> inv.getArgument(0).equals(a.getGatewayIntentId()))
                .findFirst());

        this.lockTemplate = new RequestLockTemplate(lockingRedisson(), new TransactionTemplate(transactionManager),
                new LifecycleProperties());
    }

    public RequestStateMachine stateMachine(RequestEventPublisher publisher) {
        return new RequestStateMachine(requestRepository, lockTemplate, publisher);
    }

    /** Stores a request as if it had been committed earlier; pending changes are dropped. */
    public ServiceRequest store(ServiceRequest request) {
        request.drainChanges();
        requests.put(request.getId(), request);
        return request;
    }

    private static RedissonClient lockingRedisson() {
        RedissonClient redisson = mock(RedissonClient.class);
        Map<String, RLock> locks = new ConcurrentHashMap<>();
        lenient().when(redisson.getLock(anyString()))
                .thenAnswer(inv -> locks.computeIfAbsent(inv.getArgument(0), name -> lockBackedBy(new ReentrantLock())));
        return redisson;
    }

    private static RLock lockBackedBy(ReentrantLock real) {
        return mock(RLock.class, inv -> switch (inv.getMethod().getName()) {
            case "tryLock" -> real.tryLock(inv.<Long>getArgument(0), inv.<TimeUnit>getArgument(inv.getArguments().length - 1));
            case "isHeldByCurrentThread" -> real.isHeldByCurrentThread();
            case "unlock" -> {
                real.unlock();
                yield null;
            }
            default -> RETURNS_DEFAULTS.answer(inv);
        });
    }
}
