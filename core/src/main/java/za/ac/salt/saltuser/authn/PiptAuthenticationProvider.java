package za.ac.salt.saltuser.authn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import za.ac.salt.saltuser.exception.InvalidCredentialsException;
import za.ac.salt.saltuser.exception.SaltUserException;
import za.ac.salt.saltuser.user.SaltUserService;

import java.util.List;

/**
 * Authenticates username/password tokens against the PIPT user accounts.
 * On success the principal of the returned token is a {@link PiptUserPrincipal}; roles and permissions are not
 * resolved here but by {@link za.ac.salt.saltuser.authz.ProposalSecurity} when they are needed.
 * <p>
 * Credentials which cannot be attributed to a single user are rejected like wrong credentials.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PiptAuthenticationProvider implements AuthenticationProvider {

    private final SaltUserService saltUserService;

    @Override
    public Authentication authenticate(Authentication authentication) {
        String username = authentication.getName();
        Object credentials = authentication.getCredentials();
        if (username == null || credentials == null) {
            throw new InvalidCredentialsException("invalid username or password");
        }
        long userId;
        try {
            userId = saltUserService.verifyCredentials(username, credentials.toString());
        } catch (SaltUserException e) {
            log.warn("rejecting login of {}: {}", username, e.getMessage());
            throw new InvalidCredentialsException("invalid username or password", e);
        }
        return new UsernamePasswordAuthenticationToken(new PiptUserPrincipal(userId, username), null, List.of());
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
