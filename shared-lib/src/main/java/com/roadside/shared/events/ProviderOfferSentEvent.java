package com.roadside.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.roadside.shared.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderOfferSentEvent {

    private String requestId;
    private String clientId;
    private List<String> providerIds;
    private ServiceType serviceType;
    private String originAddress;
    private double radiusKm;
    private int radiusStep;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant offeredAt;
}
