package com.ama.nipreset.adapter.directory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.ama.nipreset.config.NipResetProperties;
import com.ama.nipreset.exception.DependencyUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Identity directory client over the directory REST API.
 * Calls {@code /customers/search} with the service API key.
 */
@Component
@Slf4j
public class RestIdentityDirectory implements IdentityDirectory {

    private final WebClient webClient;
    private final Duration requestTimeout;

    public RestIdentityDirectory(WebClient.Builder webClientBuilder, NipResetProperties properties) {
        NipResetProperties.DirectoryConfig config = properties.getDirectory();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getApiUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);

        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader("X-API-Key", config.getApiKey());
        }

        this.webClient = builder.build();
        this.requestTimeout = Duration.ofSeconds(config.getTimeoutSeconds());
        log.info("NIP_DIRECTORY: Initialized - directory URL: {}", config.getApiUrl());
    }

    @Override
    public DirectoryLookup lookup(String email, String phone) {
        String normalizedEmail = normalizeEmail(email);
        String normalizedPhone = normalizePhone(phone);
        if (normalizedEmail.isEmpty() || normalizedPhone.isEmpty()) {
            return DirectoryLookup.notFound();
        }

        Map<String, Object> response;
        try {
            response = webClient.get()
                    .uri(uri -> uri.path("/customers/search")
                            .queryParam("email", normalizedEmail)
                            .queryParam("phone", normalizedPhone)
                            .build())
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .block(requestTimeout);
        } catch (WebClientResponseException.NotFound e) {
            log.debug("NIP_DIRECTORY: no customer for the given email and phone");
            return DirectoryLookup.notFound();
        } catch (Exception e) {
            log.error("NIP_DIRECTORY: lookup failed: {}", e.getMessage());
            throw new DependencyUnavailableException("Identity directory lookup failed", e);
        }

        if (response == null) {
            log.warn("NIP_DIRECTORY: empty response from directory");
            return DirectoryLookup.notFound();
        }

        DirectoryCustomer customer = new DirectoryCustomer(
                asString(response.get("customerId")),
                asString(response.get("contactRecordId")),
                asString(response.get("email")));

        if (customer.customerId() == null || customer.customerId().isBlank()) {
            log.warn("NIP_DIRECTORY: directory response without customerId");
            return DirectoryLookup.notFound();
        }

        // The directory matches loosely; the registered email must be the one given
        if (customer.email() != null && !normalizeEmail(customer.email()).equals(normalizedEmail)) {
            log.info("NIP_DIRECTORY: registered email differs for customer {}", customer.customerId());
            return DirectoryLookup.notFound();
        }

        List<DirectoryVehicle> targets = activeVehicles(response.get("vehicles"));
        log.debug("NIP_DIRECTORY: customer {} has {} eligible vehicle(s)", customer.customerId(), targets.size());
        return DirectoryLookup.of(customer, targets);
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/health")
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofSeconds(5));
            return true;
        } catch (Exception e) {
            log.warn("NIP_DIRECTORY: directory health check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<DirectoryVehicle> activeVehicles(Object vehicles) {
        List<DirectoryVehicle> result = new ArrayList<>();
        if (!(vehicles instanceof List<?> list)) {
            return result;
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> vehicle)) {
                continue;
            }
            String vehicleId = asString(vehicle.get("vehicleId"));
            if (vehicleId == null || vehicleId.isBlank() || !Boolean.TRUE.equals(vehicle.get("active"))) {
                continue;
            }
            result.add(new DirectoryVehicle(
                    vehicleId,
                    asString(vehicle.get("recordId")),
                    asString(vehicle.get("label"))));
        }
        return result;
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizePhone(String phone) {
        return phone == null ? "" : phone.replaceAll("\\D", "");
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
