package com.ama.nipreset.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.model.domain.SubjectKey;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-subject limit on reset link issuance, decided from the token ledger itself.
 * Nothing is kept in memory, so every instance of the service sees the same count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResetRateLimiter {

    private final ResetTokenStore tokenStore;
    private final NipResetProperties properties;
    private final Clock clock;

    /**
     * Check the configured window and limit.
     */
    public boolean isLimited(SubjectKey subjectKey) {
        NipResetProperties.RateLimitConfig config = properties.getRateLimit();
        return isLimited(subjectKey, Duration.ofMinutes(config.getWindowMinutes()), config.getMaxRequests());
    }

    /**
     * True when at least {@code maxCount} tokens were issued for the subject
     * inside the trailing {@code window}.
     */
    public boolean isLimited(SubjectKey subjectKey, Duration window, int maxCount) {
        LocalDateTime since = LocalDateTime.now(clock).minus(window);
        long issued = tokenStore.countIssuedSince(subjectKey, since);

        if (issued >= maxCount) {
            log.info("NIP_RATE: limit reached for {} ({} issued in last {} min, max {})",
                    subjectKey, issued, window.toMinutes(), maxCount);
            return true;
        }
        return false;
    }
}
