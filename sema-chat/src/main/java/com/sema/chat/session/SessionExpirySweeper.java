package com.sema.chat.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Instant;

/**
 * Periodically drops idle sessions from stores without native expiry.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionExpirySweeper {

    private final SessionStore sessionStore;

    @Scheduled(fixedDelayString = "${sema.chat.session.sweep-interval:PT5M}",
            initialDelayString = "${sema.chat.session.sweep-interval:PT5M}")
    public void sweep() {
        try {
            int removed = sessionStore.purgeExpired(Instant.now());
            if (removed > 0) {
                log.warn("Expired {} idle sessions from {} store", removed, sessionStore.storageType());
            }
        } catch (RuntimeException e) {
            log.error("Session expiry sweep failed", e);
        }
    }
}
