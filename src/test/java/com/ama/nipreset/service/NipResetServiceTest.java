package com.ama.nipreset.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ama.nipreset.adapter.directory.DirectoryCustomer;
import com.ama.nipreset.adapter.directory.DirectoryLookup;
import com.ama.nipreset.adapter.directory.DirectoryVehicle;
import com.ama.nipreset.adapter.directory.IdentityDirectory;
import com.ama.nipreset.adapter.mail.ResetLinkMailer;
import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.exception.DirectoryMismatchException;
import com.ama.nipreset.exception.InvalidResetTokenException;
import com.ama.nipreset.exception.ResetLinkDeliveryException;
import com.ama.nipreset.exception.ResetRateLimitedException;
import com.ama.nipreset.model.domain.CorrelationRef;
import com.ama.nipreset.model.domain.RequestContext;
import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.domain.SubjectKey;
import com.ama.nipreset.model.dto.LookupRequestDTO;
import com.ama.nipreset.model.dto.LookupResponseDTO;
import com.ama.nipreset.model.dto.SendLinkRequestDTO;
import com.ama.nipreset.model.dto.TokenInfoDTO;
import com.ama.nipreset.model.enums.CloseReason;

@ExtendWith(MockitoExtension.class)
@DisplayName("NipResetService Tests")
class NipResetServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime LOCAL_NOW = LocalDateTime.of(2026, 3, 1, 12, 0);
    private static final String EMAIL = "ana@example.com";
    private static final String PHONE = "5512345678";
    private static final DirectoryCustomer CUSTOMER = new DirectoryCustomer("C-100", "CT-9", EMAIL);
    private static final DirectoryVehicle SENTRA = new DirectoryVehicle("V-1", "VR-1", "Sentra 2020");
    private static final DirectoryVehicle VERSA = new DirectoryVehicle("V-2", "VR-2", "Versa 2022");

    @Mock
    private IdentityDirectory identityDirectory;

    @Mock
    private ResetRateLimiter rateLimiter;

    @Mock
    private ResetTokenIssuer tokenIssuer;

    @Mock
    private ResetTokenStore tokenStore;

    @Mock
    private ResetLinkMailer mailer;

    private ResetSecretService secretService;
    private NipResetService resetService;

    @BeforeEach
    void setUp() {
        NipResetProperties properties = new NipResetProperties();
        secretService = new ResetSecretService(properties);
        resetService = new NipResetService(identityDirectory, rateLimiter, tokenIssuer, tokenStore,
                secretService, mailer, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SendLinkRequestDTO sendLinkRequest(String customerId, String vehicleId) {
        return SendLinkRequestDTO.builder()
                .email(EMAIL).phone(PHONE).subjectKey(customerId).targetId(vehicleId)
                .build();
    }

    @Nested
    @DisplayName("lookup")
    class LookupTests {

        @Test
        @DisplayName("Single eligible vehicle asks for confirmation")
        void lookup_OneVehicle_SingleTargetStep() {
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA)));

            LookupResponseDTO response = resetService.lookup(new LookupRequestDTO(EMAIL, PHONE));

            assertThat(response.getStep()).isEqualTo(LookupResponseDTO.STEP_SINGLE_TARGET);
            assertThat(response.getSubjectKey()).isEqualTo("C-100");
            assertThat(response.getTargets()).singleElement()
                    .satisfies(t -> {
                        assertThat(t.getTargetId()).isEqualTo("V-1");
                        assertThat(t.getLabel()).isEqualTo("Sentra 2020");
                    });
        }

        @Test
        @DisplayName("Several vehicles ask for a selection")
        void lookup_TwoVehicles_SelectTargetStep() {
            when(identityDirectory.lookup(EMAIL, PHONE))
                    .thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA, VERSA)));

            LookupResponseDTO response = resetService.lookup(new LookupRequestDTO(EMAIL, PHONE));

            assertThat(response.getStep()).isEqualTo(LookupResponseDTO.STEP_SELECT_TARGET);
            assertThat(response.getTargets()).hasSize(2);
        }

        @Test
        @DisplayName("No match is reported as a mismatch")
        void lookup_NotFound_Throws() {
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.notFound());

            assertThatThrownBy(() -> resetService.lookup(new LookupRequestDTO(EMAIL, PHONE)))
                    .isInstanceOf(DirectoryMismatchException.class);
        }
    }

    @Nested
    @DisplayName("sendLink")
    class SendLinkTests {

        @Test
        @DisplayName("Valid pairing issues a token and mails the link")
        void sendLink_Valid_IssuesAndMails() {
            // Given
            SubjectKey subject = new SubjectKey("C-100", "V-2");
            when(identityDirectory.lookup(EMAIL, PHONE))
                    .thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA, VERSA)));
            when(rateLimiter.isLimited(subject)).thenReturn(false);
            when(tokenIssuer.issue(eq(subject), any(), any())).thenReturn("s3cr3t-Token_value");

            // When
            resetService.sendLink(sendLinkRequest("C-100", "V-2"), "203.0.113.7", "JUnit");

            // Then
            ArgumentCaptor<CorrelationRef> refCaptor = ArgumentCaptor.forClass(CorrelationRef.class);
            ArgumentCaptor<RequestContext> contextCaptor = ArgumentCaptor.forClass(RequestContext.class);
            verify(tokenIssuer).issue(eq(subject), refCaptor.capture(), contextCaptor.capture());
            assertThat(refCaptor.getValue()).isEqualTo(new CorrelationRef("CT-9", "VR-2"));
            assertThat(contextCaptor.getValue()).isEqualTo(new RequestContext("203.0.113.7", "JUnit", "Versa 2022"));

            verify(mailer).sendResetLink(EMAIL, "Versa 2022",
                    "http://localhost:5173/reset-nip?token=s3cr3t-Token_value");
        }

        @Test
        @DisplayName("Customer id not matching the directory is rejected")
        void sendLink_WrongCustomer_Throws() {
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA)));

            assertThatThrownBy(() -> resetService.sendLink(sendLinkRequest("C-999", "V-1"), "1.1.1.1", null))
                    .isInstanceOf(DirectoryMismatchException.class);
            verifyNoInteractions(rateLimiter, tokenIssuer, mailer);
        }

        @Test
        @DisplayName("Vehicle not eligible for the customer is rejected")
        void sendLink_UnknownVehicle_Throws() {
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA)));

            assertThatThrownBy(() -> resetService.sendLink(sendLinkRequest("C-100", "V-2"), "1.1.1.1", null))
                    .isInstanceOf(DirectoryMismatchException.class);
            verifyNoInteractions(tokenIssuer, mailer);
        }

        @Test
        @DisplayName("Rate-limited subject gets no new token")
        void sendLink_RateLimited_Throws() {
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA)));
            when(rateLimiter.isLimited(new SubjectKey("C-100", "V-1"))).thenReturn(true);

            assertThatThrownBy(() -> resetService.sendLink(sendLinkRequest("C-100", "V-1"), "1.1.1.1", null))
                    .isInstanceOf(ResetRateLimitedException.class);
            verifyNoInteractions(tokenIssuer, mailer);
        }

        @Test
        @DisplayName("Undelivered link closes its token")
        void sendLink_MailFails_ClosesToken() {
            // Given
            when(identityDirectory.lookup(EMAIL, PHONE)).thenReturn(DirectoryLookup.of(CUSTOMER, List.of(SENTRA)));
            when(tokenIssuer.issue(any(), any(), any())).thenReturn("undelivered");
            doThrow(new ResetLinkDeliveryException("relay down", new RuntimeException()))
                    .when(mailer).sendResetLink(any(), any(), any());

            // When / Then
            assertThatThrownBy(() -> resetService.sendLink(sendLinkRequest("C-100", "V-1"), "1.1.1.1", null))
                    .isInstanceOf(ResetLinkDeliveryException.class);
            verify(tokenStore).markUsed(secretService.hash("undelivered"), CloseReason.DELIVERY_FAILED, LOCAL_NOW);
        }
    }

    @Nested
    @DisplayName("tokenInfo")
    class TokenInfoTests {

        private ResetToken token(LocalDateTime expiresAt, LocalDateTime usedAt) {
            return ResetToken.builder()
                    .tokenHash(secretService.hash("link-token"))
                    .customerId("C-100").vehicleId("V-1").vehicleLabel("Sentra 2020")
                    .createdAt(LOCAL_NOW.minusMinutes(1)).expiresAt(expiresAt).usedAt(usedAt)
                    .build();
        }

        @Test
        @DisplayName("Active token describes its vehicle")
        void tokenInfo_Active_ReturnsInfo() {
            when(tokenStore.readByHash(secretService.hash("link-token")))
                    .thenReturn(Optional.of(token(LOCAL_NOW.plusMinutes(29), null)));

            TokenInfoDTO info = resetService.tokenInfo("link-token");

            assertThat(info.getSubjectKey()).isEqualTo("C-100");
            assertThat(info.getTargetId()).isEqualTo("V-1");
            assertThat(info.getLabel()).isEqualTo("Sentra 2020");
        }

        @Test
        @DisplayName("Expired token is rejected")
        void tokenInfo_Expired_Throws() {
            when(tokenStore.readByHash(secretService.hash("link-token")))
                    .thenReturn(Optional.of(token(LOCAL_NOW.minusSeconds(1), null)));

            assertThatThrownBy(() -> resetService.tokenInfo("link-token"))
                    .isInstanceOf(InvalidResetTokenException.class);
        }

        @Test
        @DisplayName("Used token is rejected")
        void tokenInfo_Used_Throws() {
            when(tokenStore.readByHash(secretService.hash("link-token")))
                    .thenReturn(Optional.of(token(LOCAL_NOW.plusMinutes(10), LOCAL_NOW.minusMinutes(2))));

            assertThatThrownBy(() -> resetService.tokenInfo("link-token"))
                    .isInstanceOf(InvalidResetTokenException.class);
        }

        @Test
        @DisplayName("Missing token is rejected without a lookup")
        void tokenInfo_Missing_Throws() {
            assertThatThrownBy(() -> resetService.tokenInfo(null))
                    .isInstanceOf(InvalidResetTokenException.class);
            verify(tokenStore, never()).readByHash(any());
        }
    }
}
