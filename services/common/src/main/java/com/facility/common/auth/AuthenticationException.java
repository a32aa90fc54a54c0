package com.facility.common.auth;

/**
 * Credentials were missing or rejected. The message is deliberately uniform.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException() {
        super("Unauthorized");
    }
}
