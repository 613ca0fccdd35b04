package com.ama.nipreset.repository;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.enums.CloseReason;

import jakarta.persistence.LockModeType;

/**
 * Repository for ResetToken entity.
 */
@Repository
public interface ResetTokenRepository extends JpaRepository<ResetToken, Long> {

    /**
     * Find token by its hash without locking.
     */
    Optional<ResetToken> findByTokenHash(String tokenHash);

    /**
     * Find token by its hash and hold a row lock until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM ResetToken t WHERE t.tokenHash = :tokenHash")
    Optional<ResetToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    /**
     * Close a token that has not been closed yet. Returns 0 when it was already used.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ResetToken t SET t.usedAt = :now, t.closeReason = :reason, t.activeSlot = NULL " +
           "WHERE t.tokenHash = :tokenHash AND t.usedAt IS NULL")
    int closeByHash(@Param("tokenHash") String tokenHash,
                    @Param("reason") CloseReason reason,
                    @Param("now") LocalDateTime now);

    /**
     * Supersede the unexpired holder of a subject's slot.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ResetToken t SET t.usedAt = :now, t.closeReason = :reason, t.activeSlot = NULL " +
           "WHERE t.activeSlot = :slot AND t.usedAt IS NULL AND t.expiresAt > :now")
    int closeActiveInSlot(@Param("slot") String slot,
                          @Param("reason") CloseReason reason,
                          @Param("now") LocalDateTime now);

    /**
     * Free a slot still held by an expired token. The token itself stays unused.
     * A live holder is never touched: it keeps the slot until superseded.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ResetToken t SET t.activeSlot = NULL " +
           "WHERE t.activeSlot = :slot AND t.usedAt IS NULL AND t.expiresAt <= :now")
    int releaseExpiredSlot(@Param("slot") String slot,
                           @Param("now") LocalDateTime now);

    /**
     * Count tokens issued for a customer + vehicle since the given instant.
     */
    @Query("SELECT COUNT(t) FROM ResetToken t WHERE t.customerId = :customerId " +
           "AND t.vehicleId = :vehicleId AND t.createdAt >= :since")
    long countIssuedSince(@Param("customerId") String customerId,
                          @Param("vehicleId") String vehicleId,
                          @Param("since") LocalDateTime since);

    /**
     * Count unused, unexpired tokens for a customer + vehicle.
     */
    @Query("SELECT COUNT(t) FROM ResetToken t WHERE t.customerId = :customerId " +
           "AND t.vehicleId = :vehicleId AND t.usedAt IS NULL AND t.expiresAt > :now")
    long countActive(@Param("customerId") String customerId,
                     @Param("vehicleId") String vehicleId,
                     @Param("now") LocalDateTime now);
}
