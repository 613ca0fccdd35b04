package com.ama.nipreset.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

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
import com.ama.nipreset.model.domain.SubjectKey;
import com.ama.nipreset.model.dto.LookupRequestDTO;
import com.ama.nipreset.model.dto.LookupResponseDTO;
import com.ama.nipreset.model.dto.SendLinkRequestDTO;
import com.ama.nipreset.model.dto.TargetDTO;
import com.ama.nipreset.model.dto.TokenInfoDTO;
import com.ama.nipreset.model.enums.CloseReason;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Customer-facing reset flow: lookup, send-link and token-info.
 *
 * Confirmation lives in {@link NipConfirmationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NipResetService {

    private final IdentityDirectory identityDirectory;
    private final ResetRateLimiter rateLimiter;
    private final ResetTokenIssuer tokenIssuer;
    private final ResetTokenStore tokenStore;
    private final ResetSecretService secretService;
    private final ResetLinkMailer mailer;
    private final NipResetProperties properties;
    private final Clock clock;

    /**
     * Find the customer for email + phone and list the vehicles a link can be sent for.
     *
     * @throws DirectoryMismatchException when nothing eligible matches
     */
    public LookupResponseDTO lookup(LookupRequestDTO request) {
        DirectoryLookup lookup = identityDirectory.lookup(request.getEmail(), request.getPhone());

        String step = switch (lookup.outcome()) {
            case NOT_FOUND -> throw new DirectoryMismatchException("No eligible customer for lookup");
            case SINGLE_TARGET -> LookupResponseDTO.STEP_SINGLE_TARGET;
            case MULTIPLE_TARGETS -> LookupResponseDTO.STEP_SELECT_TARGET;
        };

        List<TargetDTO> targets = lookup.targets().stream()
                .map(v -> TargetDTO.builder().targetId(v.vehicleId()).label(v.label()).build())
                .toList();

        log.info("NIP_FLOW: lookup matched customer {} with {} vehicle(s)",
                lookup.customer().customerId(), targets.size());

        return LookupResponseDTO.builder()
                .step(step)
                .subjectKey(lookup.customer().customerId())
                .targets(targets)
                .build();
    }

    /**
     * Re-validate the customer + vehicle pairing, issue a token and email the link.
     *
     * @throws DirectoryMismatchException when the pairing no longer matches the directory
     * @throws ResetRateLimitedException when too many links were issued for the vehicle
     * @throws ResetLinkDeliveryException when the email could not be sent; the token is closed
     */
    public void sendLink(SendLinkRequestDTO request, String clientIp, String userAgent) {
        DirectoryLookup lookup = identityDirectory.lookup(request.getEmail(), request.getPhone());

        if (!lookup.isFound() || !lookup.customer().customerId().equals(request.getSubjectKey())) {
            throw new DirectoryMismatchException("Customer does not match lookup data");
        }
        DirectoryVehicle vehicle = lookup.findTarget(request.getTargetId())
                .orElseThrow(() -> new DirectoryMismatchException("Vehicle not eligible for customer"));

        SubjectKey subjectKey = new SubjectKey(lookup.customer().customerId(), vehicle.vehicleId());

        if (rateLimiter.isLimited(subjectKey)) {
            throw new ResetRateLimitedException(subjectKey);
        }

        String secret = tokenIssuer.issue(
                subjectKey,
                new CorrelationRef(lookup.customer().contactRecordId(), vehicle.recordId()),
                new RequestContext(clientIp, userAgent, vehicle.label()));

        String resetUrl = UriComponentsBuilder.fromUriString(properties.getMail().getLinkBaseUrl())
                .queryParam("token", secret)
                .encode()
                .toUriString();

        String recipient = lookup.customer().email() != null ? lookup.customer().email() : request.getEmail();

        try {
            mailer.sendResetLink(recipient, vehicle.label(), resetUrl);
        } catch (ResetLinkDeliveryException e) {
            // A link nobody received must not stay usable
            tokenStore.markUsed(secretService.hash(secret), CloseReason.DELIVERY_FAILED, LocalDateTime.now(clock));
            log.warn("NIP_FLOW: reset link for {} not delivered, token closed", subjectKey);
            throw e;
        }

        log.info("NIP_FLOW: reset link sent for {}", subjectKey);
    }

    /**
     * Describe the subject of an active token.
     *
     * @throws InvalidResetTokenException when the token is unknown, used or expired
     */
    public TokenInfoDTO tokenInfo(String plaintextToken) {
        if (plaintextToken == null || plaintextToken.isBlank()) {
            throw new InvalidResetTokenException();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return tokenStore.readByHash(secretService.hash(plaintextToken))
                .filter(token -> token.isActiveAt(now))
                .map(TokenInfoDTO::fromEntity)
                .orElseThrow(InvalidResetTokenException::new);
    }
}
