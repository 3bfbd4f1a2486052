package za.ac.salt.saltuser.exception;

/**
 * Thrown when a username belongs to more than one user. Usernames are meant to be unique, so this points to a data
 * integrity problem which needs to be fixed in the database.
 */
public class AmbiguousIdentityException extends SaltUserException {

    public AmbiguousIdentityException(String message) {
        super(message);
    }
}
