package za.ac.salt.saltuser.exception;

/**
 * Thrown when a user id, username or block id does not exist in the database.
 */
public class NotFoundException extends SaltUserException {

    public NotFoundException(String message) {
        super(message);
    }
}
