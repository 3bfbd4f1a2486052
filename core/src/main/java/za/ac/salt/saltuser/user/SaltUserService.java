package za.ac.salt.saltuser.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import za.ac.salt.saltuser.spi.DataGateway;

/**
 * Creates {@link SaltUser}s backed by the application's {@link DataGateway}.
 * Every call returns a new user object, so callers control how long cached permissions live.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaltUserService {

    private final DataGateway dataGateway;

    public SaltUser resolve(long userId) {
        return SaltUser.resolve(userId, dataGateway);
    }

    public SaltUser resolveByUsername(String username) {
        return SaltUser.resolveByUsername(username, dataGateway);
    }

    public long verifyCredentials(String username, String password) {
        long userId = SaltUser.verifyCredentials(username, password, dataGateway);
        log.debug("verified credentials of {} (user id {})", username, userId);
        return userId;
    }
}
