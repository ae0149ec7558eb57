package com.roadside.notification.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stub notification transport.
 * In production: FCM/APNs for push, the provider app's alert channel for sounds.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    public static final String SOUND_NEW_OFFER = "new_request";

    public void sendPush(String userId, String title, String body) {
        if (userId == null) {
            log.debug("[PUSH] skipped, no recipient for '{}'", title);
            return;
        }
        log.info("[PUSH] userId={} title='{}' body='{}'", userId, title, body);
    }

    /** Fire-and-forget alert sound on the provider app. */
    public void playSound(String userId, String sound) {
        log.info("[SOUND] userId={} sound={}", userId, sound);
    }
}
