package com.roadside.request.payment;

import com.roadside.request.config.PaymentProperties;
import com.roadside.shared.enums.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process gateway used until a real PSP (Stripe, Mercado Pago, Adyen...) is wired in.
 *
 * Card and wallet charges are captured on the spot. Instant transfers return
 * a checkout URL and report PAID once {@code payment.simulated-settle-after}
 * has passed since the intent was created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedPaymentGateway implements PaymentGateway {

    private final PaymentProperties properties;
    private final Clock clock;
    private final Map<String, SimulatedIntent> intents = new ConcurrentHashMap<>();

    @Override
    public GatewayIntent createIntent(UUID requestId, PaymentMethod method, BigDecimal amount, String currency) {
        if (method.settlesOffPlatform()) {
            throw new PaymentGatewayException("UNSUPPORTED_METHOD", method + " is settled outside the gateway");
        }
        String intentId = "INT-" + UUID.randomUUID().toString().substring(0, 12).toUpperCase(Locale.ROOT);
        log.info("Gateway intent {}: request={} method={} amount={} {}", intentId, requestId, method, amount, currency);
        intents.put(intentId, new SimulatedIntent(method, clock.instant()));

        if (!method.confirmsAsynchronously()) {
            return new GatewayIntent(intentId, GatewayStatus.PAID, null);
        }
        return new GatewayIntent(intentId, GatewayStatus.PENDING, "https://checkout.simulated.local/pay/" + intentId);
    }

    @Override
    public GatewayStatus pollStatus(String intentId) {
        SimulatedIntent intent = intents.get(intentId);
        if (intent == null) {
            throw new PaymentGatewayException("INTENT_NOT_FOUND", "Unknown intent " + intentId);
        }
        if (!intent.method().confirmsAsynchronously()) {
            return GatewayStatus.PAID;
        }
        Instant settlesAt = intent.createdAt().plus(properties.getSimulatedSettleAfter());
        return clock.instant().isBefore(settlesAt) ? GatewayStatus.PENDING : GatewayStatus.PAID;
    }

    private record SimulatedIntent(PaymentMethod method, Instant createdAt) {
    }

    public static class PaymentGatewayException extends RuntimeException {
        private final String code;

        public PaymentGatewayException(String code, String message) {
            super(message);
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }
}
