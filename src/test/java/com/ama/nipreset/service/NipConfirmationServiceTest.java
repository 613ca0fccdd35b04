package com.ama.nipreset.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.dto.NipFinalizationPayload;
import com.ama.nipreset.model.enums.CloseReason;
import com.ama.nipreset.model.enums.ConfirmationOutcome;

@ExtendWith(MockitoExtension.class)
@DisplayName("NipConfirmationService Tests")
class NipConfirmationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime LOCAL_NOW = LocalDateTime.of(2026, 3, 1, 12, 0);
    private static final String TOKEN = "plain-reset-token";

    @Mock
    private ResetTokenStore tokenStore;

    @Mock
    private NipWebhookNotifier webhookNotifier;

    @Mock
    private PlatformTransactionManager transactionManager;

    private ResetSecretService secretService;
    private NipConfirmationService confirmationService;
    private String tokenHash;

    @BeforeEach
    void setUp() {
        NipResetProperties properties = new NipResetProperties();
        secretService = new ResetSecretService(properties);
        tokenHash = secretService.hash(TOKEN);
        lenient().when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        confirmationService = new NipConfirmationService(tokenStore, secretService, webhookNotifier,
                properties, Clock.fixed(NOW, ZoneOffset.UTC), transactionManager);
    }

    private ResetToken token(LocalDateTime expiresAt, LocalDateTime usedAt, CloseReason reason) {
        return ResetToken.builder()
                .id(1L)
                .tokenHash(tokenHash)
                .customerId("C-100")
                .vehicleId("V-1")
                .contactRecordId("CT-9")
                .vehicleRecordId("VR-1")
                .createdAt(LOCAL_NOW.minusMinutes(5))
                .expiresAt(expiresAt)
                .usedAt(usedAt)
                .closeReason(reason)
                .build();
    }

    private TransactionStatus committedStatus() {
        ArgumentCaptor<TransactionStatus> captor = ArgumentCaptor.forClass(TransactionStatus.class);
        verify(transactionManager).commit(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        @DisplayName("Mismatched confirmation touches nothing")
        void confirm_NipMismatch_NoSideEffects() {
            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "1234", "1235");

            assertThat(outcome).isEqualTo(ConfirmationOutcome.NIP_MISMATCH);
            verifyNoInteractions(tokenStore, webhookNotifier, transactionManager);
        }

        @Test
        @DisplayName("Unknown token is invalid")
        void confirm_UnknownToken_InvalidOrExpired() {
            when(tokenStore.lockActiveByHash(tokenHash)).thenReturn(Optional.empty());

            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "1234", "1234");

            assertThat(outcome).isEqualTo(ConfirmationOutcome.INVALID_OR_EXPIRED);
            assertThat(committedStatus().isRollbackOnly()).isTrue();
            verifyNoInteractions(webhookNotifier);
        }

        @Test
        @DisplayName("Expired token is invalid and never handed off")
        void confirm_ExpiredToken_InvalidOrExpired() {
            when(tokenStore.lockActiveByHash(tokenHash))
                    .thenReturn(Optional.of(token(LOCAL_NOW, null, null)));

            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "1234", "1234");

            assertThat(outcome).isEqualTo(ConfirmationOutcome.INVALID_OR_EXPIRED);
            verifyNoInteractions(webhookNotifier);
            verify(tokenStore, never()).markUsed(any(), any(), any());
        }

        @Test
        @DisplayName("Used token is invalid")
        void confirm_UsedToken_InvalidOrExpired() {
            when(tokenStore.lockActiveByHash(tokenHash)).thenReturn(Optional.of(
                    token(LOCAL_NOW.plusMinutes(20), LOCAL_NOW.minusMinutes(1), CloseReason.CONFIRMED)));

            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "1234", "1234");

            assertThat(outcome).isEqualTo(ConfirmationOutcome.INVALID_OR_EXPIRED);
            verifyNoInteractions(webhookNotifier);
        }

        @Test
        @DisplayName("Blank token is invalid without a lookup")
        void confirm_BlankToken_InvalidOrExpired() {
            assertThat(confirmationService.confirm(" ", "1234", "1234"))
                    .isEqualTo(ConfirmationOutcome.INVALID_OR_EXPIRED);
            verifyNoInteractions(tokenStore);
        }
    }

    @Nested
    @DisplayName("Handoff")
    class HandoffTests {

        @Test
        @DisplayName("Successful handoff consumes the token")
        void confirm_WebhookDelivered_Confirmed() {
            // Given
            when(tokenStore.lockActiveByHash(tokenHash))
                    .thenReturn(Optional.of(token(LOCAL_NOW.plusMinutes(25), null, null)));
            when(webhookNotifier.deliver(any())).thenReturn(true);
            when(tokenStore.markUsed(tokenHash, CloseReason.CONFIRMED, LOCAL_NOW)).thenReturn(true);

            // When
            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "4321", "4321");

            // Then
            assertThat(outcome).isEqualTo(ConfirmationOutcome.CONFIRMED);
            assertThat(committedStatus().isRollbackOnly()).isFalse();

            ArgumentCaptor<NipFinalizationPayload> captor = ArgumentCaptor.forClass(NipFinalizationPayload.class);
            verify(webhookNotifier).deliver(captor.capture());
            NipFinalizationPayload payload = captor.getValue();
            assertThat(payload.getEvent()).isEqualTo("nip.reset.confirmed");
            assertThat(payload.getCustomerId()).isEqualTo("C-100");
            assertThat(payload.getContactRecordId()).isEqualTo("CT-9");
            assertThat(payload.getVehicleId()).isEqualTo("V-1");
            assertThat(payload.getVehicleRecordId()).isEqualTo("VR-1");
            assertThat(payload.getNip()).isEqualTo("4321");
            assertThat(payload.getTimestamp()).isEqualTo("2026-03-01T12:00:00Z");
            assertThat(payload.getRequestId()).isNotBlank();
            assertThat(payload.toString()).doesNotContain("nip=");
        }

        @Test
        @DisplayName("Failed handoff rolls back and leaves the token usable")
        void confirm_WebhookFails_DependencyUnavailable() {
            when(tokenStore.lockActiveByHash(tokenHash))
                    .thenReturn(Optional.of(token(LOCAL_NOW.plusMinutes(25), null, null)));
            when(webhookNotifier.deliver(any())).thenReturn(false);

            ConfirmationOutcome outcome = confirmationService.confirm(TOKEN, "4321", "4321");

            assertThat(outcome).isEqualTo(ConfirmationOutcome.DEPENDENCY_UNAVAILABLE);
            assertThat(committedStatus().isRollbackOnly()).isTrue();
            verify(tokenStore, never()).markUsed(any(), any(), any());
        }

        @Test
        @DisplayName("Each confirmation gets its own request id")
        void confirm_TwoAttempts_DistinctRequestIds() {
            when(tokenStore.lockActiveByHash(tokenHash))
                    .thenReturn(Optional.of(token(LOCAL_NOW.plusMinutes(25), null, null)));
            when(webhookNotifier.deliver(any())).thenReturn(false, true);
            when(tokenStore.markUsed(eq(tokenHash), eq(CloseReason.CONFIRMED), any())).thenReturn(true);

            confirmationService.confirm(TOKEN, "4321", "4321");
            ConfirmationOutcome retried = confirmationService.confirm(TOKEN, "4321", "4321");

            assertThat(retried).isEqualTo(ConfirmationOutcome.CONFIRMED);
            ArgumentCaptor<NipFinalizationPayload> captor = ArgumentCaptor.forClass(NipFinalizationPayload.class);
            verify(webhookNotifier, times(2)).deliver(captor.capture());
            assertThat(captor.getAllValues().get(0).getRequestId())
                    .isNotEqualTo(captor.getAllValues().get(1).getRequestId());
        }
    }
}
