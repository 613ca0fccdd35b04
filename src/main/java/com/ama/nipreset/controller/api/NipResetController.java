package com.ama.nipreset.controller.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ama.nipreset.model.dto.ApiMessages;
import com.ama.nipreset.model.dto.ConfirmRequestDTO;
import com.ama.nipreset.model.dto.LookupRequestDTO;
import com.ama.nipreset.model.dto.LookupResponseDTO;
import com.ama.nipreset.model.dto.MessageResponseDTO;
import com.ama.nipreset.model.dto.SendLinkRequestDTO;
import com.ama.nipreset.model.dto.TokenInfoDTO;
import com.ama.nipreset.model.enums.ConfirmationOutcome;
import com.ama.nipreset.service.NipConfirmationService;
import com.ama.nipreset.service.NipResetService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for the customer-facing NIP reset flow.
 *
 * Failures other than NIP confirmation outcomes are mapped by
 * {@link com.ama.nipreset.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/nip-reset")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "NIP Reset", description = "Reset the vehicle NIP through an emailed single-use link")
public class NipResetController {

    private final NipResetService resetService;
    private final NipConfirmationService confirmationService;

    @PostMapping("/lookup")
    @Operation(summary = "Look up customer", description = "Find the customer by email and phone and list eligible vehicles")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Customer found"),
        @ApiResponse(responseCode = "400", description = "Invalid input"),
        @ApiResponse(responseCode = "404", description = "No matching customer or no eligible vehicle"),
        @ApiResponse(responseCode = "503", description = "Identity directory unavailable")
    })
    public ResponseEntity<LookupResponseDTO> lookup(@Valid @RequestBody LookupRequestDTO request) {
        return ResponseEntity.ok(resetService.lookup(request));
    }

    @PostMapping("/send-link")
    @Operation(summary = "Send reset link", description = "Issue a reset token for one vehicle and email the link")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Link sent"),
        @ApiResponse(responseCode = "400", description = "Invalid input"),
        @ApiResponse(responseCode = "404", description = "Customer and vehicle do not match"),
        @ApiResponse(responseCode = "429", description = "Too many links requested for this vehicle"),
        @ApiResponse(responseCode = "500", description = "Link could not be issued or sent")
    })
    public ResponseEntity<MessageResponseDTO> sendLink(
            @Valid @RequestBody SendLinkRequestDTO request,
            @RequestHeader(value = "User-Agent", required = false) String userAgent,
            HttpServletRequest httpRequest) {

        resetService.sendLink(request, clientIp(httpRequest), userAgent);
        return ResponseEntity.ok(MessageResponseDTO.of(ApiMessages.LINK_SENT));
    }

    @GetMapping("/token-info")
    @Operation(summary = "Describe reset link", description = "Return the vehicle of an active reset link")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Link is active"),
        @ApiResponse(responseCode = "403", description = "Link invalid, used or expired")
    })
    public ResponseEntity<TokenInfoDTO> tokenInfo(
            @Parameter(description = "Token from the reset link") @RequestParam(required = false) String token) {
        return ResponseEntity.ok(resetService.tokenInfo(token));
    }

    @PostMapping("/confirm")
    @Operation(summary = "Confirm new NIP", description = "Consume the reset link and hand the new NIP to the system of record")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "NIP updated"),
        @ApiResponse(responseCode = "400", description = "Invalid input or NIP confirmation mismatch"),
        @ApiResponse(responseCode = "403", description = "Link invalid, used or expired"),
        @ApiResponse(responseCode = "503", description = "System of record unavailable, link still usable")
    })
    public ResponseEntity<MessageResponseDTO> confirm(@Valid @RequestBody ConfirmRequestDTO request) {
        ConfirmationOutcome outcome = confirmationService.confirm(
                request.getToken(), request.getNewSecret(), request.getNewSecretConfirmation());

        return switch (outcome) {
            case CONFIRMED -> ResponseEntity.ok(MessageResponseDTO.of(ApiMessages.NIP_UPDATED));
            case NIP_MISMATCH -> ResponseEntity.badRequest()
                    .body(MessageResponseDTO.of(ApiMessages.NIP_MISMATCH));
            case INVALID_OR_EXPIRED -> ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(MessageResponseDTO.of(ApiMessages.INVALID_LINK));
            case DEPENDENCY_UNAVAILABLE -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(MessageResponseDTO.of(ApiMessages.SERVICE_UNAVAILABLE));
        };
    }

    /**
     * Address appended by the single trusted proxy (last X-Forwarded-For entry),
     * else the socket address. Entries to its left are client-supplied.
     */
    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String[] hops = forwarded.split(",");
            String last = hops[hops.length - 1].trim();
            if (!last.isEmpty()) {
                return last;
            }
        }
        return request.getRemoteAddr();
    }
}
