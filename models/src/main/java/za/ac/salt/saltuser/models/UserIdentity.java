package za.ac.salt.saltuser.models;

/**
 * The identity of a PIPT user, as recorded for the investigator linked to the user account.
 *
 * @param userId     the {@code PiptUser_Id}
 * @param givenName  the given name(s)
 * @param familyName the family name
 * @param email      the email address
 */
public record UserIdentity(long userId, String givenName, String familyName, String email) {
}
