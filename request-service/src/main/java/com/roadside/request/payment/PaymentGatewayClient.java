package com.roadside.request.payment;

import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.shared.enums.PaymentMethod;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Resilient edge in front of {@link PaymentGateway}. Retries with backoff, then
 * opens the circuit; once it gives up the caller sees {@link ExternalUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGatewayClient {

    private final PaymentGateway gateway;

    @CircuitBreaker(name = "payment-gateway", fallbackMethod = "createIntentFallback")
    @Retry(name = "payment-gateway")
    public GatewayIntent createIntent(UUID requestId, PaymentMethod method, BigDecimal amount, String currency) {
        return gateway.createIntent(requestId, method, amount, currency);
    }

    @CircuitBreaker(name = "payment-gateway", fallbackMethod = "pollStatusFallback")
    @Retry(name = "payment-gateway")
    public GatewayStatus pollStatus(String intentId) {
        return gateway.pollStatus(intentId);
    }

    public GatewayIntent createIntentFallback(UUID requestId, PaymentMethod method, BigDecimal amount,
                                              String currency, Throwable ex) {
        log.error("Gateway createIntent failed for request {} ({}): {}", requestId, method, ex.getMessage());
        throw new ExternalUnavailableException("Payment gateway unavailable", ex);
    }

    public GatewayStatus pollStatusFallback(String intentId, Throwable ex) {
        log.warn("Gateway pollStatus failed for intent {}: {}", intentId, ex.getMessage());
        throw new ExternalUnavailableException("Payment gateway unavailable", ex);
    }
}
