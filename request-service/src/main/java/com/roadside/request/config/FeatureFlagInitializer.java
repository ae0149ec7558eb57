package com.roadside.request.config;

import com.roadside.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds default feature flags on startup. Flags already set in Redis are kept.
 *
 * To toggle a flag at runtime without restart:
 *   redis-cli HSET feature-flags:default request_kill_switch true
 *   redis-cli HSET feature-flags:default auto_finish_enabled false
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            featureFlagService.initDefaults("default");
            log.info("Feature flags initialised for scope=default");
        };
    }
}
