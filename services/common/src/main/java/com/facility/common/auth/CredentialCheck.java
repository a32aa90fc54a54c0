package com.facility.common.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * One step of the authentication chain. A check either decides the outcome
 * or abstains so the next check runs.
 */
public interface CredentialCheck {

    Verdict evaluate(Credentials credentials, Set<AuthScheme> allowed);

    enum Verdict {
        ACCEPT,
        REJECT,
        ABSTAIN
    }

    /**
     * Constant-time comparison of a presented secret with the configured one.
     * A missing configured secret never matches.
     */
    static boolean secretEquals(String presented, String expected) {
        if (presented == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
