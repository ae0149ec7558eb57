package com.roadside.request.geo;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProviderCandidate {

    private String providerId;
    private double latitude;
    private double longitude;
    private double distanceKm;
}
