package com.roadside.request.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DirectPaymentPayload {

    @NotBlank
    private String clientId;

    private boolean enabled;
}
