package com.ama.nipreset.exception;

import com.ama.nipreset.model.domain.SubjectKey;

/**
 * Exception thrown when a customer + vehicle asked for too many reset links.
 */
public class ResetRateLimitedException extends RuntimeException {

    public ResetRateLimitedException(SubjectKey subjectKey) {
        super("Reset link rate limit reached for " + subjectKey);
    }
}
