package com.roadside.location.controller;

import com.roadside.location.model.LocationUpdateRequest;
import com.roadside.location.service.ProviderLocationService;
import com.roadside.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
public class ProviderLocationController {

    private final ProviderLocationService locationService;

    /**
     * Location heartbeat, sent every few seconds by each online provider app.
     * Last write wins, so no idempotency key is needed.
     */
    @PostMapping("/locations")
    public ResponseEntity<ApiResponse<Void>> updateLocation(@Valid @RequestBody LocationUpdateRequest request) {
        locationService.updateLocation(request);
        return ResponseEntity.ok(ApiResponse.ok(null));
    }

    @PostMapping("/{providerId}/offline")
    public ResponseEntity<ApiResponse<Void>> goOffline(@PathVariable("providerId") String providerId) {
        locationService.goOffline(providerId);
        return ResponseEntity.ok(ApiResponse.ok(null));
    }

    @GetMapping("/{providerId}/meta")
    public ResponseEntity<ApiResponse<Map<Object, Object>>> getProviderMeta(
            @PathVariable("providerId") String providerId) {
        Map<Object, Object> meta = locationService.getProviderMeta(providerId);
        if (meta.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ApiResponse.ok(meta));
    }
}
