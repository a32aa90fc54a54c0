package com.facility.common.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Authentication schemes an endpoint may accept.
 */
public enum AuthScheme {
    NONE("none"),
    BASIC("basic"),
    BEARER("bearer"),
    API_KEY("apikey");

    private final String value;

    AuthScheme(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AuthScheme fromValue(String value) {
        for (AuthScheme scheme : AuthScheme.values()) {
            if (scheme.value.equalsIgnoreCase(value)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("Unknown auth scheme: " + value);
    }
}
