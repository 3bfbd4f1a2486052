package za.ac.salt.saltuser.user;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.DigestUtils;
import za.ac.salt.saltuser.exception.AmbiguousIdentityException;
import za.ac.salt.saltuser.exception.InvalidCredentialsException;
import za.ac.salt.saltuser.exception.NotFoundException;
import za.ac.salt.saltuser.models.UserIdentity;
import za.ac.salt.saltuser.models.enums.RoleSetting;
import za.ac.salt.saltuser.spi.DataGateway;
import za.ac.salt.saltuser.utils.Memoized;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static za.ac.salt.saltuser.user.SaltUserQueries.*;

/**
 * A user of the Southern African Large Telescope with roles and permissions.
 * <p>
 * The user is identified by their PIPT user id or by the username they use for the Principal Investigator Proposal
 * Tool (PIPT) and the Web Manager. This class only checks roles and permissions; it does no authentication.
 * <p>
 * The partners on whose TACs the user serves are loaded when the user is created. Whether the user is a Board member
 * and which proposals they may view are looked up on first use and then kept for the lifetime of the object. All
 * other checks query the database every time. Instances are meant to live for a single request, so that none of the
 * cached facts can become noticeably stale.
 * <p>
 * Administrator rights are deliberately not cached: revoking them takes effect with the next call of
 * {@link #isAdmin()}, even for a user object which is already in use.
 */
@Slf4j
public final class SaltUser {

    /**
     * Bound instead of an empty partner list, as {@code IN ()} is not valid SQL. No partner has this code.
     */
    private static final String NO_PARTNER = "IMPOSSIBLE_VALUE";

    private static final RowMapper<Long> LONG_COLUMN = (rs, rowNum) -> rs.getLong(1);
    private static final RowMapper<String> STRING_COLUMN = (rs, rowNum) -> rs.getString(1);

    private final DataGateway dataGateway;
    private final UserIdentity identity;
    private final Set<String> tacMemberPartners;
    private final Set<String> tacChairPartners;
    private final Memoized<Boolean> boardMember;
    private final Memoized<Set<String>> viewableProposals;

    private SaltUser(UserIdentity identity, DataGateway dataGateway) {
        this.identity = identity;
        this.dataGateway = dataGateway;
        this.tacMemberPartners = Set.copyOf(queryForUser(TAC_MEMBER_PARTNERS, STRING_COLUMN));
        this.tacChairPartners = Set.copyOf(queryForUser(TAC_CHAIR_PARTNERS, STRING_COLUMN));
        this.boardMember = new Memoized<>(() -> hasRoleSetting(RoleSetting.RIGHT_BOARD));
        this.viewableProposals = new Memoized<>(this::findViewableProposals);
    }

    /**
     * Get the user with a given user id.
     *
     * @param userId      the PIPT user id
     * @param dataGateway access to the database
     * @return the user
     * @throws NotFoundException if there is no user with the id
     */
    public static SaltUser resolve(long userId, DataGateway dataGateway) {
        List<UserIdentity> identities = dataGateway.query(USER_BY_ID, Map.of(USER_ID, userId), SaltUser::mapIdentity);
        if (identities.isEmpty()) {
            throw new NotFoundException("There is no user with id " + userId + ".");
        }
        log.debug("resolved user {}", userId);
        return new SaltUser(identities.get(0), dataGateway);
    }

    /**
     * Get the user with a given username.
     *
     * @param username    the username
     * @param dataGateway access to the database
     * @return the user
     * @throws NotFoundException          if the username does not exist
     * @throws AmbiguousIdentityException if more than one user has the username
     */
    public static SaltUser resolveByUsername(String username, DataGateway dataGateway) {
        List<Long> userIds = dataGateway.query(USER_IDS_BY_USERNAME, Map.of(USERNAME, username), LONG_COLUMN);
        if (userIds.isEmpty()) {
            throw new NotFoundException("The username does not exist: " + username);
        }
        if (userIds.size() > 1) {
            throw new AmbiguousIdentityException("The username " + username + " belongs to " + userIds.size() + " users: " + userIds);
        }
        return resolve(userIds.get(0), dataGateway);
    }

    /**
     * Verify that a username-password combination is valid.
     * <p>
     * The database stores the hex encoded MD5 digest of the password, so only the digest is sent to the database.
     *
     * @param username    the username
     * @param password    the password
     * @param dataGateway access to the database
     * @return the user id of the verified user
     * @throws InvalidCredentialsException if the username or password is wrong or missing
     * @throws AmbiguousIdentityException  if the credentials match more than one user
     */
    public static long verifyCredentials(String username, String password, DataGateway dataGateway) {
        if (username == null || password == null) {
            throw new InvalidCredentialsException("invalid username or password");
        }
        String passwordHash = DigestUtils.md5DigestAsHex(password.getBytes(StandardCharsets.UTF_8));
        List<Long> userIds = dataGateway.query(USER_IDS_BY_CREDENTIALS, Map.of(USERNAME, username, PASSWORD_HASH, passwordHash), LONG_COLUMN);
        if (userIds.isEmpty()) {
            throw new InvalidCredentialsException("invalid username or password");
        }
        if (userIds.size() > 1) {
            throw new AmbiguousIdentityException("The credentials for " + username + " match " + userIds.size() + " users: " + userIds);
        }
        return userIds.get(0);
    }

    public long getUserId() {
        return identity.userId();
    }

    public UserIdentity getIdentity() {
        return identity;
    }

    public String getGivenName() {
        return identity.givenName();
    }

    public String getFamilyName() {
        return identity.familyName();
    }

    public String getEmail() {
        return identity.email();
    }

    /**
     * The partner codes of the TACs on which the user serves.
     */
    public Set<String> getTacMemberPartners() {
        return tacMemberPartners;
    }

    /**
     * The partner codes of the TACs which the user chairs.
     */
    public Set<String> getTacChairPartners() {
        return tacChairPartners;
    }

    /**
     * Check whether the user is an administrator. The database is queried on every call.
     */
    public boolean isAdmin() {
        return hasRoleSetting(RoleSetting.RIGHT_ADMIN);
    }

    /**
     * Check whether the user is a Board member. The database is only queried on the first call.
     */
    public boolean isBoardMember() {
        return boardMember.get();
    }

    /**
     * Check whether the user is an investigator on a proposal.
     *
     * @param proposalCode the proposal code
     */
    public boolean isInvestigator(String proposalCode) {
        return countForProposal(INVESTIGATOR_COUNT, proposalCode) > 0;
    }

    /**
     * Check whether the user is the Principal Investigator of a proposal.
     *
     * @param proposalCode the proposal code
     */
    public boolean isPrincipalInvestigator(String proposalCode) {
        return countForProposal(LEADER_COUNT, proposalCode) > 0;
    }

    /**
     * Check whether the user is the Principal Contact of a proposal.
     *
     * @param proposalCode the proposal code
     */
    public boolean isPrincipalContact(String proposalCode) {
        return countForProposal(CONTACT_COUNT, proposalCode) > 0;
    }

    public boolean isTacMember(String partnerCode) {
        return tacMemberPartners.contains(partnerCode);
    }

    public boolean isTacChair(String partnerCode) {
        return tacChairPartners.contains(partnerCode);
    }

    /**
     * Check whether the user serves on the TAC of a partner represented among a proposal's investigators.
     *
     * @param proposalCode the proposal code
     */
    public boolean isProposalTacMember(String proposalCode) {
        if (tacMemberPartners.isEmpty()) {
            return false;
        }
        List<String> proposalPartners = dataGateway.query(PROPOSAL_PARTNERS, Map.of(PROPOSAL_CODE, proposalCode), STRING_COLUMN);
        return proposalPartners.stream().anyMatch(tacMemberPartners::contains);
    }

    /**
     * Check whether the user may view a proposal.
     * <p>
     * A user may view the proposals on which they are an investigator and the proposals requesting time from a
     * partner on whose TAC they serve. Administrators and Board members may view all proposals. All proposals the
     * user may view are looked up on the first call, and the result is used for all subsequent calls.
     *
     * @param proposalCode the proposal code
     */
    public boolean mayViewProposal(String proposalCode) {
        return viewableProposals.get().contains(proposalCode);
    }

    /**
     * Check whether the user may edit a proposal. This is the case for the proposal's Principal Investigator and
     * Principal Contact, and for administrators.
     *
     * @param proposalCode the proposal code
     */
    public boolean mayEditProposal(String proposalCode) {
        return isPrincipalInvestigator(proposalCode) || isPrincipalContact(proposalCode) || isAdmin();
    }

    /**
     * Check whether the user may view a block, i.e. whether they may view the proposal containing it.
     *
     * @param blockId the block id
     * @throws NotFoundException if there exists no block with the id
     */
    public boolean mayViewBlock(long blockId) {
        return mayViewProposal(proposalCodeOfBlock(blockId));
    }

    /**
     * Check whether the user may edit a block, i.e. whether they may edit the proposal containing it.
     *
     * @param blockId the block id
     * @throws NotFoundException if there exists no block with the id
     */
    public boolean mayEditBlock(long blockId) {
        return mayEditProposal(proposalCodeOfBlock(blockId));
    }

    private Set<String> findViewableProposals() {
        Map<String, Object> parameters = Map.of(
                USER_ID, getUserId(),
                TAC_PARTNERS, tacMemberPartners.isEmpty() ? List.of(NO_PARTNER) : tacMemberPartners,
                IS_ADMIN, isAdmin() ? 1 : 0,
                IS_BOARD_MEMBER, isBoardMember() ? 1 : 0);
        Set<String> proposalCodes = Set.copyOf(dataGateway.query(VIEWABLE_PROPOSALS, parameters, STRING_COLUMN));
        log.debug("user {} may view {} proposals", getUserId(), proposalCodes.size());
        return proposalCodes;
    }

    private boolean hasRoleSetting(RoleSetting setting) {
        List<String> values = dataGateway.query(SETTING_VALUES, Map.of(USER_ID, getUserId(), SETTING_NAME, setting.getSettingName()), STRING_COLUMN);
        return values.stream().anyMatch(value -> grantsRole(setting, value));
    }

    private boolean grantsRole(RoleSetting setting, String value) {
        if (value == null) {
            return false;
        }
        try {
            return Integer.parseInt(value.trim(), 10) > 0;
        } catch (NumberFormatException e) {
            log.warn("ignoring non-numeric value '{}' of setting {} for user {}", value, setting.getSettingName(), getUserId());
            return false;
        }
    }

    private long countForProposal(String sql, String proposalCode) {
        List<Long> counts = dataGateway.query(sql, Map.of(PROPOSAL_CODE, proposalCode, USER_ID, getUserId()), LONG_COLUMN);
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    private String proposalCodeOfBlock(long blockId) {
        List<String> proposalCodes = dataGateway.query(BLOCK_PROPOSAL_CODE, Map.of(BLOCK_ID, blockId), STRING_COLUMN);
        if (proposalCodes.isEmpty()) {
            throw new NotFoundException("There exists no block with id " + blockId);
        }
        return proposalCodes.get(0);
    }

    private <T> List<T> queryForUser(String sql, RowMapper<T> rowMapper) {
        return dataGateway.query(sql, Map.of(USER_ID, getUserId()), rowMapper);
    }

    private static UserIdentity mapIdentity(ResultSet rs, int rowNum) throws SQLException {
        return new UserIdentity(rs.getLong("PiptUser_Id"), rs.getString("FirstName"), rs.getString("Surname"), rs.getString("Email"));
    }
}
