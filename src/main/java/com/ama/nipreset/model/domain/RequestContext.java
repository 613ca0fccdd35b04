package com.ama.nipreset.model.domain;

/**
 * Metadata captured with each reset request.
 *
 * @param ipAddress    client IP (first X-Forwarded-For hop when proxied)
 * @param userAgent    raw User-Agent header, may be null
 * @param vehicleLabel display label of the vehicle
 */
public record RequestContext(String ipAddress, String userAgent, String vehicleLabel) {
}
