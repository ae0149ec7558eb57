package com.roadside.request.service;

import com.roadside.request.support.MutableClock;
import com.roadside.request.support.RequestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AutoFinishJobTest {

    @Mock private RequestLifecycleOrchestrator orchestrator;

    @Test
    @DisplayName("Each sweep asks the orchestrator to finish requests as of the current clock")
    void sweepUsesClock() {
        MutableClock clock = new MutableClock(RequestFixtures.T0);
        AutoFinishJob job = new AutoFinishJob(orchestrator, clock);

        job.finishUnconfirmed();

        verify(orchestrator).autoFinishExpired(RequestFixtures.T0);
    }
}
