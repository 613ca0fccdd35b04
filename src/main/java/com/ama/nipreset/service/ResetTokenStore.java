package com.ama.nipreset.service;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.ama.nipreset.model.domain.ResetToken;
import com.ama.nipreset.model.domain.SubjectKey;
import com.ama.nipreset.model.enums.CloseReason;
import com.ama.nipreset.repository.ResetTokenRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger of reset tokens. Every mutation of a token row goes through here.
 *
 * The store does not judge expiry or use: callers classify the rows it returns.
 * Locking operations require the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResetTokenStore {

    private final ResetTokenRepository repository;

    /**
     * Read a token by hash and lock its row until the current transaction ends.
     * Concurrent callers locking the same row wait for the holder.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<ResetToken> lockActiveByHash(String tokenHash) {
        return repository.findByTokenHashForUpdate(tokenHash);
    }

    /**
     * Read a token by hash without locking.
     */
    @Transactional(readOnly = true)
    public Optional<ResetToken> readByHash(String tokenHash) {
        return repository.findByTokenHash(tokenHash);
    }

    /**
     * Close a token. Returns false when it had already been closed.
     */
    @Transactional
    public boolean markUsed(String tokenHash, CloseReason reason, LocalDateTime now) {
        int updated = repository.closeByHash(tokenHash, reason, now);
        if (updated == 0) {
            log.debug("NIP_STORE: token {} already closed", prefix(tokenHash));
            return false;
        }
        return true;
    }

    /**
     * Supersede the subject's unexpired token and free a slot still held by an
     * expired one. Returns the number of superseded tokens (0 or 1).
     *
     * A holder committed by a concurrent issuer after the supersede step keeps
     * its slot, so the following insert fails and the caller retries.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int supersedeActive(SubjectKey subjectKey, LocalDateTime now) {
        String slot = subjectKey.asSlot();
        int superseded = repository.closeActiveInSlot(slot, CloseReason.SUPERSEDED, now);
        int released = repository.releaseExpiredSlot(slot, now);
        if (superseded > 0 || released > 0) {
            log.debug("NIP_STORE: subject {} superseded={} released={}", subjectKey, superseded, released);
        }
        return superseded;
    }

    /**
     * Insert a new token and flush so constraint violations surface immediately.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ResetToken insert(ResetToken token) {
        return repository.saveAndFlush(token);
    }

    /**
     * Count tokens issued for a subject at or after the given instant.
     */
    @Transactional(readOnly = true)
    public long countIssuedSince(SubjectKey subjectKey, LocalDateTime since) {
        return repository.countIssuedSince(subjectKey.customerId(), subjectKey.vehicleId(), since);
    }

    /**
     * Count unused, unexpired tokens for a subject.
     */
    @Transactional(readOnly = true)
    public long countActive(SubjectKey subjectKey, LocalDateTime now) {
        return repository.countActive(subjectKey.customerId(), subjectKey.vehicleId(), now);
    }

    private static String prefix(String tokenHash) {
        return tokenHash == null ? "null" : tokenHash.substring(0, Math.min(8, tokenHash.length()));
    }
}
