package com.roadside.request.payment;

/**
 * Gateway-side charge session. A fresh one is opened for every payment attempt.
 *
 * @param checkoutUrl redirect target for asynchronous methods, null otherwise
 */
public record GatewayIntent(String intentId, GatewayStatus status, String checkoutUrl) {
}
