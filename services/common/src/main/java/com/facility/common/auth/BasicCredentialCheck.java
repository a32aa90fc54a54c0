package com.facility.common.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Set;

/**
 * {@code Authorization: Basic base64(user:pass)}. The decoded payload must contain
 * exactly one colon.
 */
public final class BasicCredentialCheck implements CredentialCheck {

    private static final String PREFIX = "Basic";

    private final String username;
    private final String password;

    public BasicCredentialCheck(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public Verdict evaluate(Credentials credentials, Set<AuthScheme> allowed) {
        if (!credentials.hasAuthorization()
                || !credentials.authorization().startsWith(PREFIX)
                || !allowed.contains(AuthScheme.BASIC)) {
            return Verdict.ABSTAIN;
        }
        return matches(credentials.authorizationToken()) ? Verdict.ACCEPT : Verdict.ABSTAIN;
    }

    private boolean matches(String encoded) {
        if (encoded == null) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        String[] parts = decoded.split(":", -1);
        if (parts.length != 2) {
            return false;
        }
        boolean userMatches = CredentialCheck.secretEquals(parts[0], username);
        boolean passwordMatches = CredentialCheck.secretEquals(parts[1], password);
        return userMatches && passwordMatches;
    }
}
