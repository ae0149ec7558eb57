package com.roadside.location.model;

import com.roadside.shared.enums.ServiceType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.Set;

@Data
public class LocationUpdateRequest {

    @NotBlank
    private String providerId;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @NotEmpty
    private Set<ServiceType> services;

    /** Farthest origin the provider is willing to drive to; null or 0 means no limit. */
    @PositiveOrZero
    private Double radarRangeKm;

    private boolean online = true;
}
