package com.roadside.request.payment;

import com.roadside.request.config.PaymentProperties;
import com.roadside.request.exception.ExternalUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Bounded polling fallback for asynchronous payments. At most one poll runs per
 * request; starting a new one replaces the old. A poll stops on the first
 * settled status, on {@link #stop(UUID)}, or when the ceiling is reached.
 */
@Slf4j
@Component
public class PaymentConfirmationPoller {

    /** Callbacks run on the scheduler thread after the poll has been stopped. */
    public interface Listener {
        void onSettled(GatewayStatus status);

        void onCeilingReached();
    }

    private final PaymentGatewayClient gatewayClient;
    private final TaskScheduler taskScheduler;
    private final PaymentProperties properties;
    private final Clock clock;
    private final Map<UUID, ActivePoll> polls = new ConcurrentHashMap<>();

    public PaymentConfirmationPoller(PaymentGatewayClient gatewayClient,
                                     TaskScheduler taskScheduler,
                                     PaymentProperties properties,
                                     Clock clock) {
        this.gatewayClient = gatewayClient;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public void start(UUID requestId, String intentId, Listener listener) {
        Instant now = clock.instant();
        ActivePoll poll = new ActivePoll(intentId, now.plus(properties.getPollCeiling()), listener);
        ActivePoll previous = polls.put(requestId, poll);
        if (previous != null) {
            previous.cancel();
        }
        poll.future = taskScheduler.scheduleAtFixedRate(() -> pollOnce(requestId, poll),
                now.plus(properties.getPollInterval()), properties.getPollInterval());
        if (poll.canceled) {
            poll.future.cancel(false);
        }
        log.info("Polling intent {} for request {} until {}", intentId, requestId, poll.deadline);
    }

    public void stop(UUID requestId) {
        ActivePoll poll = polls.remove(requestId);
        if (poll != null) {
            poll.cancel();
            log.debug("Stopped polling for request {}", requestId);
        }
    }

    public boolean isPolling(UUID requestId) {
        return polls.containsKey(requestId);
    }

    private void pollOnce(UUID requestId, ActivePoll poll) {
        if (polls.get(requestId) != poll) {
            poll.cancel();
            return;
        }
        if (!clock.instant().isBefore(poll.deadline)) {
            finish(requestId, poll);
            log.info("Polling ceiling reached for request {} (intent {}); payment stays CONFIRMING",
                    requestId, poll.intentId);
            notifyListener(requestId, poll.listener::onCeilingReached);
            return;
        }
        GatewayStatus status;
        try {
            status = gatewayClient.pollStatus(poll.intentId);
        } catch (ExternalUnavailableException e) {
            log.warn("Poll for request {} failed, will retry: {}", requestId, e.getMessage());
            return;
        }
        if (!status.isSettled()) {
            return;
        }
        finish(requestId, poll);
        notifyListener(requestId, () -> poll.listener.onSettled(status));
    }

    private void finish(UUID requestId, ActivePoll poll) {
        polls.remove(requestId, poll);
        poll.cancel();
    }

    private void notifyListener(UUID requestId, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Payment poll callback failed for request {}: {}", requestId, e.getMessage(), e);
        }
    }

    private static final class ActivePoll {
        private final String intentId;
        private final Instant deadline;
        private final Listener listener;
        private volatile ScheduledFuture<?> future;
        private volatile boolean canceled;

        private ActivePoll(String intentId, Instant deadline, Listener listener) {
            this.intentId = intentId;
            this.deadline = deadline;
            this.listener = listener;
        }

        private void cancel() {
            canceled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
