package com.roadside.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.roadside.shared.enums.SearchState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchProgressEvent {

    private String requestId;
    private String clientId;
    private SearchState previousState;
    private SearchState state;
    private double radiusKm;
    private int radiusStep;
    private int totalSteps;
    private int candidateCount;

    /** Set when the index could not be queried; the session retries on its own. */
    private String error;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant occurredAt;
}
