package com.ama.nipreset.service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.model.dto.NipFinalizationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Delivers the signed finalization event to the NIP system of record.
 *
 * Signature: HMAC-SHA256 over {@code timestamp + "." + body}, hex encoded, sent as
 * {@code X-Webhook-Signature: sha256=<hex>} next to {@code X-Webhook-Timestamp}
 * (epoch seconds). The body sent is byte-for-byte the body that was signed.
 *
 * Retry is synchronous, fixed-delay and bounded because callers hold a row lock
 * while waiting for the result.
 */
@Service
@Slf4j
public class NipWebhookNotifier {

    public static final String HEADER_EVENT = "X-Webhook-Event";
    public static final String HEADER_TIMESTAMP = "X-Webhook-Timestamp";
    public static final String HEADER_SIGNATURE = "X-Webhook-Signature";
    public static final String HEADER_REQUEST_ID = "X-Request-Id";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final NipResetProperties properties;
    private final Clock clock;

    public NipWebhookNotifier(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            NipResetProperties properties,
            Clock clock) {
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Deliver the payload. Returns true once the receiver answered 2xx, false when
     * every attempt failed or the webhook is not configured.
     */
    public boolean deliver(NipFinalizationPayload payload) {
        NipResetProperties.WebhookConfig config = properties.getWebhook();
        String requestId = payload.getRequestId();

        if (isBlank(config.getUrl()) || isBlank(config.getSecret())) {
            log.error("NIP_WEBHOOK: webhook url or secret not configured, delivery {} not attempted", requestId);
            return false;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("NIP_WEBHOOK: could not serialize payload {}", requestId);
            return false;
        }

        String timestamp = String.valueOf(Instant.now(clock).getEpochSecond());
        String signature = sign(timestamp + "." + body, config.getSecret());
        int maxAttempts = Math.max(1, config.getAttempts());
        AtomicInteger attempt = new AtomicInteger();

        try {
            Mono.defer(() -> {
                        attempt.incrementAndGet();
                        return webClient.post()
                                .uri(config.getUrl())
                                .header(HEADER_EVENT, payload.getEvent())
                                .header(HEADER_TIMESTAMP, timestamp)
                                .header(HEADER_SIGNATURE, "sha256=" + signature)
                                .header(HEADER_REQUEST_ID, requestId)
                                .bodyValue(body)
                                .retrieve()
                                .toBodilessEntity()
                                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
                    })
                    .doOnError(e -> log.warn("NIP_WEBHOOK: attempt {}/{} for {} failed: {}",
                            attempt.get(), maxAttempts, requestId, describe(e)))
                    .retryWhen(Retry.fixedDelay(maxAttempts - 1L, Duration.ofMillis(config.getRetryDelayMs())))
                    .block();

            log.info("NIP_WEBHOOK: delivered {} on attempt {}/{}", requestId, attempt.get(), maxAttempts);
            return true;

        } catch (Exception e) {
            Throwable cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
            log.error("NIP_WEBHOOK: delivery {} failed after {} attempt(s): {}",
                    requestId, attempt.get(), describe(cause));
            return false;
        }
    }

    /**
     * HMAC-SHA256 of {@code data} with {@code secret}, lowercase hex.
     */
    public static String sign(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return ResetSecretService.bytesToHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute webhook signature", e);
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        return e.getClass().getSimpleName();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
