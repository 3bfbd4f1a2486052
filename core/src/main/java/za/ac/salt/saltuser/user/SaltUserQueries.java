package za.ac.salt.saltuser.user;

/**
 * Queries against the SALT science database, with the names of the parameters they bind.
 */
final class SaltUserQueries {

    static final String USER_ID = "userId";
    static final String USERNAME = "username";
    static final String PASSWORD_HASH = "passwordHash";
    static final String SETTING_NAME = "settingName";
    static final String PROPOSAL_CODE = "proposalCode";
    static final String BLOCK_ID = "blockId";
    static final String TAC_PARTNERS = "tacPartners";
    static final String IS_ADMIN = "isAdmin";
    static final String IS_BOARD_MEMBER = "isBoardMember";

    static final String USER_BY_ID = "SELECT pu.PiptUser_Id, i.FirstName, i.Surname, i.Email "
            + "FROM PiptUser AS pu "
            + "JOIN Investigator AS i ON pu.Investigator_Id = i.Investigator_Id "
            + "WHERE pu.PiptUser_Id = :userId";

    static final String USER_IDS_BY_USERNAME = "SELECT PiptUser_Id FROM PiptUser WHERE Username = :username";

    static final String USER_IDS_BY_CREDENTIALS = "SELECT PiptUser_Id "
            + "FROM PiptUser "
            + "WHERE Username = :username AND Password = :passwordHash";

    static final String SETTING_VALUES = "SELECT pus.Value "
            + "FROM PiptUserSetting AS pus "
            + "JOIN PiptSetting AS ps ON pus.PiptSetting_Id = ps.PiptSetting_Id "
            + "WHERE pus.PiptUser_Id = :userId AND ps.PiptSetting_Name = :settingName";

    static final String INVESTIGATOR_COUNT = "SELECT COUNT(*) AS User_Count "
            + "FROM ProposalCode AS pc "
            + "JOIN ProposalInvestigator AS pi ON pc.ProposalCode_Id = pi.ProposalCode_Id "
            + "JOIN Investigator AS i ON pi.Investigator_Id = i.Investigator_Id "
            + "WHERE pc.Proposal_Code = :proposalCode AND i.PiptUser_Id = :userId";

    static final String LEADER_COUNT = "SELECT COUNT(*) AS User_Count "
            + "FROM ProposalContact AS pco "
            + "JOIN Investigator AS i ON pco.Leader_Id = i.Investigator_Id "
            + "JOIN ProposalCode AS pc ON pco.ProposalCode_Id = pc.ProposalCode_Id "
            + "WHERE pc.Proposal_Code = :proposalCode AND i.PiptUser_Id = :userId";

    static final String CONTACT_COUNT = "SELECT COUNT(*) AS User_Count "
            + "FROM ProposalContact AS pco "
            + "JOIN Investigator AS i ON pco.Contact_Id = i.Investigator_Id "
            + "JOIN ProposalCode AS pc ON pco.ProposalCode_Id = pc.ProposalCode_Id "
            + "WHERE pc.Proposal_Code = :proposalCode AND i.PiptUser_Id = :userId";

    static final String TAC_MEMBER_PARTNERS = "SELECT p.Partner_Code "
            + "FROM PiptUserTAC AS putac "
            + "JOIN Partner AS p ON putac.Partner_Id = p.Partner_Id "
            + "WHERE putac.PiptUser_Id = :userId";

    static final String TAC_CHAIR_PARTNERS = "SELECT p.Partner_Code "
            + "FROM PiptUserTAC AS putac "
            + "JOIN Partner AS p ON putac.Partner_Id = p.Partner_Id "
            + "WHERE putac.PiptUser_Id = :userId AND putac.Chair = 1";

    /**
     * Partners represented among a proposal's investigators, by way of the investigators' institutes.
     */
    static final String PROPOSAL_PARTNERS = "SELECT DISTINCT p.Partner_Code "
            + "FROM Partner AS p "
            + "JOIN Institute AS ins ON p.Partner_Id = ins.Partner_Id "
            + "JOIN Investigator AS i ON ins.Institute_Id = i.Institute_Id "
            + "JOIN ProposalInvestigator AS pi ON i.Investigator_Id = pi.Investigator_Id "
            + "JOIN ProposalCode AS pc ON pi.ProposalCode_Id = pc.ProposalCode_Id "
            + "WHERE pc.Proposal_Code = :proposalCode";

    /**
     * Every proposal the user may view. The admin and board flags are bound as 0 or 1, so that either of them being
     * set turns the filter into "all proposals".
     */
    static final String VIEWABLE_PROPOSALS = "SELECT DISTINCT pc.Proposal_Code "
            + "FROM ProposalCode AS pc "
            + "JOIN ProposalInvestigator AS pi ON pc.ProposalCode_Id = pi.ProposalCode_Id "
            + "JOIN Investigator AS i ON pi.Investigator_Id = i.Investigator_Id "
            + "JOIN PiptUser AS pu ON i.PiptUser_Id = pu.PiptUser_Id "
            + "JOIN Proposal AS p ON pc.ProposalCode_Id = p.ProposalCode_Id "
            + "JOIN MultiPartner AS mp ON pc.ProposalCode_Id = mp.ProposalCode_Id "
            + "AND p.Semester_Id = mp.Semester_Id "
            + "JOIN Partner AS partner ON mp.Partner_Id = partner.Partner_Id "
            + "WHERE pu.PiptUser_Id = :userId "
            + "OR (partner.Partner_Code IN (:tacPartners) AND mp.ReqTimeAmount > 0) "
            + "OR 1 = :isAdmin "
            + "OR 1 = :isBoardMember";

    static final String BLOCK_PROPOSAL_CODE = "SELECT pc.Proposal_Code "
            + "FROM ProposalCode AS pc "
            + "JOIN Block AS b ON pc.ProposalCode_Id = b.ProposalCode_Id "
            + "WHERE b.Block_Id = :blockId";

    private SaltUserQueries() {
    }
}
