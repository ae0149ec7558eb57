package com.roadside.request.payment;

import com.roadside.request.config.PaymentProperties;
import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.support.MutableClock;
import com.roadside.request.support.RequestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentConfirmationPollerTest {

    private static final UUID REQUEST = UUID.randomUUID();

    @Mock private PaymentGatewayClient gatewayClient;
    @Mock private TaskScheduler taskScheduler;
    @Mock private ScheduledFuture<Object> future;

    private MutableClock clock;
    private PaymentConfirmationPoller poller;
    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<String> heard = new ArrayList<>();

    private final PaymentConfirmationPoller.Listener listener = new PaymentConfirmationPoller.Listener() {
        @Override
        public void onSettled(GatewayStatus status) {
            heard.add(status.name());
        }

        @Override
        public void onCeilingReached() {
            heard.add("CEILING");
        }
    };

    @BeforeEach
    void setUp() {
        clock = new MutableClock(RequestFixtures.T0);
        PaymentProperties properties = new PaymentProperties();
        properties.setPollInterval(Duration.ofSeconds(2));
        properties.setPollCeiling(Duration.ofSeconds(10));
        lenient().when(taskScheduler.scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class)))
                .thenAnswer(inv -> {
                    scheduled.add(inv.getArgument(0));
                    return future;
                });
        poller = new PaymentConfirmationPoller(gatewayClient, taskScheduler, properties, clock);
    }

    @Test
    @DisplayName("Pending answers keep polling; the first settled one stops it and notifies once")
    void stopsOnSettled() {
        when(gatewayClient.pollStatus("INT-1"))
                .thenReturn(GatewayStatus.PENDING)
                .thenReturn(GatewayStatus.PAID);
        poller.start(REQUEST, "INT-1", listener);

        scheduled.get(0).run();
        assertThat(poller.isPolling(REQUEST)).isTrue();
        scheduled.get(0).run();

        assertThat(poller.isPolling(REQUEST)).isFalse();
        assertThat(heard).containsExactly("PAID");
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("A gateway outage during a poll is retried on the next tick")
    void outageIsRetried() {
        when(gatewayClient.pollStatus("INT-1"))
                .thenThrow(new ExternalUnavailableException("gateway down", null))
                .thenReturn(GatewayStatus.FAILED);
        poller.start(REQUEST, "INT-1", listener);

        scheduled.get(0).run();
        assertThat(poller.isPolling(REQUEST)).isTrue();
        scheduled.get(0).run();

        assertThat(heard).containsExactly("FAILED");
    }

    @Test
    @DisplayName("Ceiling stops polling without asking the gateway again")
    void ceiling() {
        poller.start(REQUEST, "INT-1", listener);
        clock.advance(Duration.ofSeconds(10));

        scheduled.get(0).run();

        assertThat(heard).containsExactly("CEILING");
        assertThat(poller.isPolling(REQUEST)).isFalse();
        verify(gatewayClient, never()).pollStatus(any());
    }

    @Test
    @DisplayName("Starting a new poll replaces the old one, whose ticks become no-ops")
    void restartReplacesPreviousPoll() {
        when(gatewayClient.pollStatus("INT-2")).thenReturn(GatewayStatus.PENDING);
        poller.start(REQUEST, "INT-1", listener);
        poller.start(REQUEST, "INT-2", listener);

        scheduled.get(0).run();
        scheduled.get(1).run();

        verify(gatewayClient, never()).pollStatus("INT-1");
        verify(gatewayClient, times(1)).pollStatus("INT-2");
        assertThat(heard).isEmpty();
    }

    @Test
    @DisplayName("Stopped polls never call back")
    void stopSilences() {
        poller.start(REQUEST, "INT-1", listener);
        poller.stop(REQUEST);

        scheduled.get(0).run();

        assertThat(poller.isPolling(REQUEST)).isFalse();
        assertThat(heard).isEmpty();
        verify(gatewayClient, never()).pollStatus(any());
    }
}
