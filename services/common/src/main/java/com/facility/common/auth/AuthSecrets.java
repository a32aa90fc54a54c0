package com.facility.common.auth;

/**
 * Configured secrets each scheme is checked against.
 */
public record AuthSecrets(String basicUser, String basicPassword, String bearerToken, String apiKey) {
}
