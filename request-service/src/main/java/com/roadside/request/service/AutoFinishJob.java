package com.roadside.request.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Closes out services the provider marked complete but the client never confirmed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoFinishJob {

    private final RequestLifecycleOrchestrator orchestrator;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${lifecycle.auto-finish.interval-ms:60000}")
    public void finishUnconfirmed() {
        int finished = orchestrator.autoFinishExpired(clock.instant());
        log.debug("Auto-finish sweep done: {} finished", finished);
    }
}
