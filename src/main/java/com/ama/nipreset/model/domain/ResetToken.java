package com.ama.nipreset.model.domain;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

import com.ama.nipreset.model.enums.CloseReason;
import com.ama.nipreset.model.enums.ResetTokenState;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-use NIP reset token, scoped to one customer + vehicle.
 *
 * Only the SHA-256 hash of the secret is stored. The secret travels once, inside
 * the reset link emailed to the customer.
 *
 * The {@code active_slot} column holds the subject key while this row is the
 * subject's current token and is cleared when the row is closed or its slot is
 * released. Its unique constraint is what keeps a second active token from being
 * inserted for the same subject by a concurrent request.
 */
@Entity
@Table(name = "nip_reset_tokens",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_nip_reset_token_hash", columnNames = "token_hash"),
        @UniqueConstraint(name = "uk_nip_reset_active_slot", columnNames = "active_slot")
    },
    indexes = {
        @Index(name = "idx_nip_reset_tokens_cliente_vehiculo_created_at",
               columnList = "customer_id, vehicle_id, created_at"),
        @Index(name = "idx_nip_reset_tokens_expires", columnList = "expires_at")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResetToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * SHA-256 hex digest of the reset secret.
     */
    @NotBlank
    @Size(min = 64, max = 64)
    @Column(name = "token_hash", nullable = false, length = 64, updatable = false)
    private String tokenHash;

    /**
     * Customer identifier in the identity directory.
     */
    @NotBlank
    @Column(name = "customer_id", nullable = false, length = 64, updatable = false)
    private String customerId;

    /**
     * Vehicle identifier in the identity directory.
     */
    @NotBlank
    @Column(name = "vehicle_id", nullable = false, length = 64, updatable = false)
    private String vehicleId;

    /**
     * Subject key while this row owns the subject's active slot, null afterwards.
     */
    @Column(name = "active_slot", length = 140)
    private String activeSlot;

    /**
     * Directory record of the contact (sent in the webhook payload).
     */
    @Column(name = "contact_record_id", length = 64, updatable = false)
    private String contactRecordId;

    /**
     * Directory record of the vehicle (sent in the webhook payload).
     */
    @Column(name = "vehicle_record_id", length = 64, updatable = false)
    private String vehicleRecordId;

    /**
     * Display label of the vehicle at issuance time.
     */
    @Column(name = "vehicle_label", length = 120, updatable = false)
    private String vehicleLabel;

    @Column(name = "request_ip", length = 64, updatable = false)
    private String requestIp;

    @Column(name = "user_agent", length = 255, updatable = false)
    private String userAgent;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @NotNull
    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    /**
     * Null while the token can still be used. Written once.
     */
    @Column(name = "used_at")
    private LocalDateTime usedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", length = 20)
    private CloseReason closeReason;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }

    @Transient
    public SubjectKey getSubjectKey() {
        return new SubjectKey(customerId, vehicleId);
    }

    /**
     * Classify this token at the given instant.
     */
    public ResetTokenState stateAt(LocalDateTime now) {
        if (usedAt != null) {
            return ResetTokenState.fromCloseReason(closeReason);
        }
        if (!now.isBefore(expiresAt)) {
            return ResetTokenState.EXPIRED;
        }
        return ResetTokenState.ACTIVE;
    }

    /**
     * Check if this token can still be confirmed at the given instant.
     */
    public boolean isActiveAt(LocalDateTime now) {
        return stateAt(now) == ResetTokenState.ACTIVE;
    }

    /**
     * Short hash prefix for log lines.
     */
    @Transient
    public String getHashPrefix() {
        return tokenHash == null ? "null" : tokenHash.substring(0, Math.min(8, tokenHash.length()));
    }
}
