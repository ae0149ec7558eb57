package com.roadside.request.payment;

import com.roadside.shared.enums.PaymentMethod;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * External payment gateway. Card and wallet charges answer synchronously;
 * instant transfers answer PENDING and settle later, reported through the
 * webhook push channel and through {@link #pollStatus(String)}.
 */
public interface PaymentGateway {

    GatewayIntent createIntent(UUID requestId, PaymentMethod method, BigDecimal amount, String currency);

    GatewayStatus pollStatus(String intentId);
}
