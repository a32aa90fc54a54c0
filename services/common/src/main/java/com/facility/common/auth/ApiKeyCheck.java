package com.facility.common.auth;

import java.util.Set;

/**
 * An API key, when present and allowed, is authoritative: a wrong key rejects
 * the request even if a valid Authorization header accompanies it.
 */
public final class ApiKeyCheck implements CredentialCheck {

    private final String expectedKey;

    public ApiKeyCheck(String expectedKey) {
        this.expectedKey = expectedKey;
    }

    @Override
    public Verdict evaluate(Credentials credentials, Set<AuthScheme> allowed) {
        if (!credentials.hasApiKey() || !allowed.contains(AuthScheme.API_KEY)) {
            return Verdict.ABSTAIN;
        }
        return CredentialCheck.secretEquals(credentials.apiKey(), expectedKey) ? Verdict.ACCEPT : Verdict.REJECT;
    }
}
