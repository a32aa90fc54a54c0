package com.facility.common.auth;

/**
 * Credential material extracted from a request. Blank header values are normalized to null.
 *
 * @param authorization raw {@code Authorization} header, e.g. {@code Basic dXNlcjpwYXNz}
 * @param apiKey        raw {@code X-API-Key} header
 */
public record Credentials(String authorization, String apiKey) {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String API_KEY_HEADER = "X-API-Key";

    public Credentials {
        authorization = normalize(authorization);
        apiKey = normalize(apiKey);
    }

    public static Credentials of(String authorization, String apiKey) {
        return new Credentials(authorization, apiKey);
    }

    public static Credentials anonymous() {
        return new Credentials(null, null);
    }

    public boolean isEmpty() {
        return authorization == null && apiKey == null;
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    public boolean hasAuthorization() {
        return authorization != null;
    }

    /**
     * Returns the part after the first space of the Authorization header, or null.
     */
    public String authorizationToken() {
        if (authorization == null) {
            return null;
        }
        String[] parts = authorization.split(" ");
        return parts.length > 1 ? parts[1] : null;
    }

    private static String normalize(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    @Override
    public String toString() {
        // never print secrets
        return "Credentials[authorization=" + (authorization != null ? "***" : "none")
                + ", apiKey=" + (apiKey != null ? "***" : "none") + "]";
    }
}
