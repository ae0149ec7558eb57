package com.roadside.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderLocationUpdatedEvent {

    private String providerId;
    private double latitude;
    private double longitude;
    private boolean online;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;
}
