package com.ama.nipreset.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.ama.nipreset.adapter.directory.IdentityDirectory;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the identity directory.
 *
 * Reports DOWN when the directory is unreachable; lookups and send-link then answer 503.
 */
@Component
@RequiredArgsConstructor
public class DirectoryHealthIndicator implements HealthIndicator {

    private final IdentityDirectory identityDirectory;

    @Override
    public Health health() {
        if (identityDirectory.isAvailable()) {
            return Health.up()
                    .withDetail("identity-directory", "connected")
                    .build();
        }
        return Health.down()
                .withDetail("identity-directory", "unreachable")
                .build();
    }
}
