package com.roadside.request.service;

import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.matching.MatchingEngine;
import com.roadside.request.repository.ServiceRequestRepository;
import com.roadside.shared.enums.RequestStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Search sessions live in memory. After a restart every request still in
 * SEARCHING gets a fresh one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchSessionRecovery implements ApplicationRunner {

    private final ServiceRequestRepository requestRepository;
    private final MatchingEngine matchingEngine;

    @Override
    public void run(ApplicationArguments args) {
        List<ServiceRequest> searching = requestRepository.findByStatus(RequestStatus.SEARCHING);
        for (ServiceRequest request : searching) {
            matchingEngine.startSearch(request);
        }
        if (!searching.isEmpty()) {
            log.info("Recovered {} search session(s) after startup", searching.size());
        }
    }
}
