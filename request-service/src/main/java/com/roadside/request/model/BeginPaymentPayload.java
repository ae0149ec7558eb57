package com.roadside.request.model;

import com.roadside.shared.enums.PaymentMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BeginPaymentPayload {

    @NotBlank
    private String clientId;

    @NotNull
    private PaymentMethod method;
}
