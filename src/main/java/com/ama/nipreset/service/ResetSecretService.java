package com.ama.nipreset.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Service;

import com.ama.nipreset.config.NipResetProperties;

import lombok.RequiredArgsConstructor;

/**
 * Generates reset secrets and derives the hash stored in their place.
 *
 * Secrets are base64url strings over SecureRandom bytes (256 bits by default),
 * hashed with SHA-256 into a 64-char lowercase hex string.
 */
@Service
@RequiredArgsConstructor
public class ResetSecretService {

    private final NipResetProperties properties;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Generate a new random reset secret.
     */
    public String generateSecret() {
        byte[] bytes = new byte[properties.getToken().getSecretBytes()];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * One-way digest of a reset secret.
     */
    public String hash(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
