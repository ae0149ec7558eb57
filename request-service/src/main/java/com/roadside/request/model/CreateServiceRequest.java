package com.roadside.request.model;

import com.roadside.shared.enums.ServiceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateServiceRequest {

    @NotBlank
    private String clientId;

    @NotNull
    private ServiceType serviceType;

    @NotNull
    @Valid
    private LocationPayload origin;

    /** Required for towing only. */
    @Valid
    private LocationPayload destination;

    private String vehicleInfo;
}
