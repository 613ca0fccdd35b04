package com.ama.nipreset.adapter.mail;

import java.time.Duration;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.exception.ResetLinkDeliveryException;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends reset links through the HTTP mail relay ({@code POST /messages}).
 * The link carries the plaintext token and is never logged.
 */
@Component
@Slf4j
public class RelayResetLinkMailer implements ResetLinkMailer {

    private final WebClient webClient;
    private final NipResetProperties.MailConfig config;
    private final int ttlMinutes;

    public RelayResetLinkMailer(WebClient.Builder webClientBuilder, NipResetProperties properties) {
        this.config = properties.getMail();
        this.ttlMinutes = properties.getToken().getTtlMinutes();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getApiUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }

        this.webClient = builder.build();
        log.info("NIP_MAIL: Initialized - relay URL: {}", config.getApiUrl());
    }

    @Override
    public void sendResetLink(String email, String vehicleLabel, String resetUrl) {
        Map<String, Object> message = Map.of(
                "from", config.getFrom(),
                "to", email,
                "subject", config.getSubject(),
                "text", buildText(vehicleLabel, resetUrl));

        try {
            webClient.post()
                    .uri("/messages")
                    .bodyValue(message)
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofSeconds(config.getTimeoutSeconds()));
            log.info("NIP_MAIL: reset link sent to {}", maskEmail(email));
        } catch (Exception e) {
            log.error("NIP_MAIL: relay rejected reset link for {}: {}", maskEmail(email), e.getMessage());
            throw new ResetLinkDeliveryException("Mail relay did not accept the reset link", e);
        }
    }

    private String buildText(String vehicleLabel, String resetUrl) {
        StringBuilder text = new StringBuilder();
        text.append("Recibimos una solicitud para reiniciar el NIP");
        if (vehicleLabel != null && !vehicleLabel.isBlank()) {
            text.append(" de tu vehiculo ").append(vehicleLabel);
        }
        text.append(".\n\n")
            .append("Abre la siguiente liga para definir tu nuevo NIP:\n")
            .append(resetUrl).append("\n\n")
            .append("La liga es de un solo uso y expira en ").append(ttlMinutes).append(" minutos. ")
            .append("Si no solicitaste el cambio, ignora este correo.");
        return text.toString();
    }

    static String maskEmail(String email) {
        if (email == null) {
            return "null";
        }
        int at = email.indexOf('@');
        if (at <= 1) {
            return "***" + (at >= 0 ? email.substring(at) : "");
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
