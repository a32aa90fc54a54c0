package com.facility.common.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs an ordered list of {@link CredentialCheck}s against a request's credentials.
 * The first check that does not abstain decides; if every check abstains the
 * request is rejected.
 */
public class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final List<CredentialCheck> checks;

    public Authenticator(List<CredentialCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /**
     * Standard chain: anonymous, API key, basic, bearer.
     */
    public static Authenticator withSecrets(AuthSecrets secrets) {
        return new Authenticator(List.of(
                new AnonymousCheck(),
                new ApiKeyCheck(secrets.apiKey()),
                new BasicCredentialCheck(secrets.basicUser(), secrets.basicPassword()),
                new BearerTokenCheck(secrets.bearerToken())
        ));
    }

    public boolean isAccepted(Credentials credentials, Set<AuthScheme> allowed) {
        for (CredentialCheck check : checks) {
            switch (check.evaluate(credentials, allowed)) {
                case ACCEPT:
                    return true;
                case REJECT:
                    log.debug("Credentials rejected by {}", check.getClass().getSimpleName());
                    return false;
                default:
                    break;
            }
        }
        log.debug("No check accepted {} for schemes {}", credentials, allowed);
        return false;
    }

    /**
     * @throws AuthenticationException if the credentials are not accepted
     */
    public void authenticate(Credentials credentials, Set<AuthScheme> allowed) {
        if (!isAccepted(credentials, allowed)) {
            throw new AuthenticationException();
        }
    }
}
