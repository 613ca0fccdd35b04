package com.ama.nipreset.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.exception.TokenIssuanceException;
import com.ama.nipreset.model.domain.CorrelationRef;
import com.ama.nipreset.model.domain.RequestContext;
import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.domain.SubjectKey;

import lombok.extern.slf4j.Slf4j;

/**
 * Issues reset tokens.
 *
 * Each attempt runs in its own transaction: supersede the subject's current token,
 * then insert the new one. Two concurrent issuers for the same subject cannot both
 * commit, because the second insert hits the unique active-slot constraint. The
 * loser rolls back and retries with a fresh secret, this time superseding the
 * winner's row. A token-hash collision is resolved the same way.
 */
@Service
@Slf4j
public class ResetTokenIssuer {

    private final ResetTokenStore tokenStore;
    private final ResetSecretService secretService;
    private final NipResetProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public ResetTokenIssuer(
            ResetTokenStore tokenStore,
            ResetSecretService secretService,
            NipResetProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.tokenStore = tokenStore;
        this.secretService = secretService;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Issue a token for the subject and return its plaintext secret. The secret is
     * returned only here; the ledger keeps its hash.
     *
     * @throws TokenIssuanceException if no token could be persisted
     */
    public String issue(SubjectKey subjectKey, CorrelationRef correlationRef, RequestContext requestContext) {
        int maxAttempts = Math.max(1, properties.getToken().getMaxIssueAttempts());
        RuntimeException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String secret = secretService.generateSecret();
            String tokenHash = secretService.hash(secret);

            try {
                ResetToken saved = transactionTemplate.execute(status ->
                        supersedeAndInsert(subjectKey, tokenHash, correlationRef, requestContext));

                log.info("NIP_ISSUE: issued token {} for {} (expires {})",
                        saved.getHashPrefix(), subjectKey, saved.getExpiresAt());
                return secret;

            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                lastConflict = e;
                log.warn("NIP_ISSUE: write conflict for {} on attempt {}/{} ({})",
                        subjectKey, attempt, maxAttempts, e.getClass().getSimpleName());
            }
        }

        throw new TokenIssuanceException(
                "Failed to issue reset token for " + subjectKey + " after " + maxAttempts + " attempts",
                lastConflict);
    }

    private ResetToken supersedeAndInsert(SubjectKey subjectKey, String tokenHash,
                                          CorrelationRef correlationRef, RequestContext requestContext) {
        LocalDateTime now = LocalDateTime.now(clock);

        int superseded = tokenStore.supersedeActive(subjectKey, now);
        if (superseded > 0) {
            log.info("NIP_ISSUE: superseded previous token for {}", subjectKey);
        }

        ResetToken token = ResetToken.builder()
                .tokenHash(tokenHash)
                .customerId(subjectKey.customerId())
                .vehicleId(subjectKey.vehicleId())
                .activeSlot(subjectKey.asSlot())
                .contactRecordId(correlationRef != null ? correlationRef.contactRecordId() : null)
                .vehicleRecordId(correlationRef != null ? correlationRef.vehicleRecordId() : null)
                .vehicleLabel(requestContext != null ? truncate(requestContext.vehicleLabel(), 120) : null)
                .requestIp(requestContext != null ? truncate(requestContext.ipAddress(), 64) : null)
                .userAgent(requestContext != null ? truncate(requestContext.userAgent(), 255) : null)
                .createdAt(now)
                .expiresAt(now.plusMinutes(properties.getToken().getTtlMinutes()))
                .build();

        return tokenStore.insert(token);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
