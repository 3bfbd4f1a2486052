package za.ac.salt.saltuser.authn;

import org.springframework.security.core.AuthenticatedPrincipal;

/**
 * Principal of a user who logged in with their PIPT credentials.
 */
public record PiptUserPrincipal(long userId, String username) implements AuthenticatedPrincipal {

    @Override
    public String getName() {
        return username;
    }
}
