package com.roadside.request.matching;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class SearchSessionTicker {

    private final MatchingEngine matchingEngine;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${matching.tick-interval-ms:1000}")
    public void tick() {
        matchingEngine.tick(clock.instant());
    }
}
