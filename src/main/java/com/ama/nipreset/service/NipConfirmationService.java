package com.ama.nipreset.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.dto.NipFinalizationPayload;
import com.ama.nipreset.model.enums.CloseReason;
import com.ama.nipreset.model.enums.ConfirmationOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Confirms a new NIP with a reset token.
 *
 * The token row stays locked from validation until the webhook result is known,
 * so a token can never be finalized twice, even while a slow receiver is being
 * retried. The lock is held for at most the notifier's attempts, timeouts and
 * delays. When the receiver keeps failing the transaction rolls back and the
 * token remains usable.
 */
@Service
@Slf4j
public class NipConfirmationService {

    private final ResetTokenStore tokenStore;
    private final ResetSecretService secretService;
    private final NipWebhookNotifier webhookNotifier;
    private final NipResetProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public NipConfirmationService(
            ResetTokenStore tokenStore,
            ResetSecretService secretService,
            NipWebhookNotifier webhookNotifier,
            NipResetProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.tokenStore = tokenStore;
        this.secretService = secretService;
        this.webhookNotifier = webhookNotifier;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Confirm {@code newNip} for the subject of {@code plaintextToken}.
     */
    public ConfirmationOutcome confirm(String plaintextToken, String newNip, String newNipConfirmation) {
        if (newNip == null || !newNip.equals(newNipConfirmation)) {
            log.info("NIP_CONFIRM: rejected, NIP confirmation does not match");
            return ConfirmationOutcome.NIP_MISMATCH;
        }
        if (plaintextToken == null || plaintextToken.isBlank()) {
            return ConfirmationOutcome.INVALID_OR_EXPIRED;
        }

        String tokenHash = secretService.hash(plaintextToken);

        ConfirmationOutcome outcome = transactionTemplate.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            Optional<ResetToken> locked = tokenStore.lockActiveByHash(tokenHash);

            if (locked.isEmpty() || !locked.get().isActiveAt(now)) {
                status.setRollbackOnly();
                log.info("NIP_CONFIRM: token {} is invalid or expired",
                        locked.map(ResetToken::getHashPrefix).orElse("unknown"));
                return ConfirmationOutcome.INVALID_OR_EXPIRED;
            }

            ResetToken token = locked.get();
            NipFinalizationPayload payload = buildPayload(token, newNip);

            if (!webhookNotifier.deliver(payload)) {
                status.setRollbackOnly();
                log.warn("NIP_CONFIRM: handoff {} failed for token {}, token left active",
                        payload.getRequestId(), token.getHashPrefix());
                return ConfirmationOutcome.DEPENDENCY_UNAVAILABLE;
            }

            if (!tokenStore.markUsed(tokenHash, CloseReason.CONFIRMED, LocalDateTime.now(clock))) {
                // Unreachable while the row lock is held
                status.setRollbackOnly();
                log.error("NIP_CONFIRM: token {} was closed while locked (handoff {})",
                        token.getHashPrefix(), payload.getRequestId());
                return ConfirmationOutcome.INVALID_OR_EXPIRED;
            }

            log.info("NIP_CONFIRM: NIP updated for {} via handoff {}",
                    token.getSubjectKey(), payload.getRequestId());
            return ConfirmationOutcome.CONFIRMED;
        });

        return outcome != null ? outcome : ConfirmationOutcome.INVALID_OR_EXPIRED;
    }

    private NipFinalizationPayload buildPayload(ResetToken token, String newNip) {
        return NipFinalizationPayload.builder()
                .event(properties.getWebhook().getEventName())
                .requestId(UUID.randomUUID().toString())
                .timestamp(Instant.now(clock).toString())
                .customerId(token.getCustomerId())
                .contactRecordId(token.getContactRecordId())
                .vehicleId(token.getVehicleId())
                .vehicleRecordId(token.getVehicleRecordId())
                .nip(newNip)
                .build();
    }
}
