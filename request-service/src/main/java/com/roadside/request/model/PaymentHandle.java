package com.roadside.request.model;

import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * What the client gets back from beginPayment.
 *
 * IMMEDIATE: the gateway answered synchronously (card/wallet).
 * CHECKOUT: redirect to {@code checkoutUrl}; confirmation arrives out-of-band.
 * DIRECT: settled between the parties; the provider confirms receipt.
 */
@Data
@Builder
public class PaymentHandle {

    public enum Kind { IMMEDIATE, CHECKOUT, DIRECT }

    private UUID attemptId;
    private UUID requestId;
    private Kind kind;
    private PaymentMethod method;
    private PaymentStatus status;
    private String checkoutUrl;
    private boolean confirmed;
}
