package com.ama.nipreset.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ama.nipreset.config.NipResetProperties;

@DisplayName("ResetSecretService Tests")
class ResetSecretServiceTest {

    private ResetSecretService secretService;

    @BeforeEach
    void setUp() {
        secretService = new ResetSecretService(new NipResetProperties());
    }

    @Test
    @DisplayName("Secrets are url-safe and carry 256 bits")
    void generateSecret_DefaultSize_Is43UrlSafeChars() {
        String secret = secretService.generateSecret();

        assertThat(secret).hasSize(43).matches("[A-Za-z0-9_-]+");
    }

    @Test
    @DisplayName("Secrets do not repeat")
    void generateSecret_ManyCalls_AllDistinct() {
        Set<String> secrets = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            secrets.add(secretService.generateSecret());
        }

        assertThat(secrets).hasSize(500);
    }

    @Test
    @DisplayName("Hash is lowercase hex SHA-256 and deterministic")
    void hash_KnownInput_ReturnsSha256Hex() {
        // SHA-256("abc")
        assertThat(secretService.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(secretService.hash("abc")).isEqualTo(secretService.hash("abc"));
    }

    @Test
    @DisplayName("Hash never equals the secret")
    void hash_GeneratedSecret_DiffersFromSecret() {
        String secret = secretService.generateSecret();

        assertThat(secretService.hash(secret)).hasSize(64).isNotEqualTo(secret);
    }

    @Test
    @DisplayName("Null secret is rejected")
    void hash_Null_Throws() {
        assertThatThrownBy(() -> secretService.hash(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
