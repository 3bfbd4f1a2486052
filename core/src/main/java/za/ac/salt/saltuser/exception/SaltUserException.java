package za.ac.salt.saltuser.exception;

/**
 * Base class for failures to resolve users or the resources their permissions refer to.
 */
public class SaltUserException extends RuntimeException {

    public SaltUserException(String message) {
        super(message);
    }

    public SaltUserException(String message, Throwable cause) {
        super(message, cause);
    }
}
