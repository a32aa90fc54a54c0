package com.facility.common.auth;

import java.util.Set;

/**
 * {@code Authorization: Bearer <token>} compared literally with the configured token.
 */
public final class BearerTokenCheck implements CredentialCheck {

    private static final String PREFIX = "Bearer";

    private final String expectedToken;

    public BearerTokenCheck(String expectedToken) {
        this.expectedToken = expectedToken;
    }

    @Override
    public Verdict evaluate(Credentials credentials, Set<AuthScheme> allowed) {
        if (!credentials.hasAuthorization()
                || !credentials.authorization().startsWith(PREFIX)
                || !allowed.contains(AuthScheme.BEARER)) {
            return Verdict.ABSTAIN;
        }
        return CredentialCheck.secretEquals(credentials.authorizationToken(), expectedToken)
                ? Verdict.ACCEPT
                : Verdict.ABSTAIN;
    }
}
