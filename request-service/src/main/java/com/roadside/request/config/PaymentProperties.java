package com.roadside.request.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "payment")
public class PaymentProperties {

    private String currency = "BRL";

    private Duration pollInterval = Duration.ofSeconds(2);

    /** Polling stops after this long; the attempt stays CONFIRMING. */
    private Duration pollCeiling = Duration.ofMinutes(2);

    /** Superseded intents younger than this are still asked whether the client paid them anyway. */
    private Duration supersededReconciliationWindow = Duration.ofHours(24);

    /** How long the simulated gateway keeps an instant transfer pending before reporting it paid. */
    private Duration simulatedSettleAfter = Duration.ofSeconds(20);
}
