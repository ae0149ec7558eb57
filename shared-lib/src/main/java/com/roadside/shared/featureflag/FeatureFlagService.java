package com.roadside.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration. Set a flag via Redis CLI:
 *   HSET feature-flags:default request_kill_switch true
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";
    private static final String DEFAULT_SCOPE   = "default";

    public static final String REQUEST_KILL_SWITCH    = "request_kill_switch";
    public static final String AUTO_FINISH_ENABLED    = "auto_finish_enabled";
    public static final String DIRECT_PAYMENT_ENABLED = "direct_payment_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns true if the flag is enabled for the given scope.
     * Falls back to the global scope, then to the provided default value.
     */
    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        if (scopedVal != null) {
            return Boolean.parseBoolean(scopedVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_SCOPE, flagName, defaultValue);
    }

    public void setFlag(String scope, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + scope, flagName, String.valueOf(value));
        log.info("Feature flag set: scope={} flag={} value={}", scope, flagName, value);
    }

    /**
     * Initialise default flags if they are not yet set (called at startup).
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        redisTemplate.opsForHash().putIfAbsent(key, REQUEST_KILL_SWITCH, "false");
        redisTemplate.opsForHash().putIfAbsent(key, AUTO_FINISH_ENABLED, "true");
        redisTemplate.opsForHash().putIfAbsent(key, DIRECT_PAYMENT_ENABLED, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }
}
