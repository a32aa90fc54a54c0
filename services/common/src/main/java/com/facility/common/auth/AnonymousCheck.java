package com.facility.common.auth;

import java.util.Set;

/**
 * Decides requests carrying no credential at all.
 */
public final class AnonymousCheck implements CredentialCheck {

    @Override
    public Verdict evaluate(Credentials credentials, Set<AuthScheme> allowed) {
        if (!credentials.isEmpty()) {
            return Verdict.ABSTAIN;
        }
        return allowed.contains(AuthScheme.NONE) ? Verdict.ACCEPT : Verdict.REJECT;
    }
}
