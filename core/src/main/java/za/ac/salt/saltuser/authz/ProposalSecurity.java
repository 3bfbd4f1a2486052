package za.ac.salt.saltuser.authz;

import lombok.RequiredArgsConstructor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import za.ac.salt.saltuser.authn.PiptUserPrincipal;
import za.ac.salt.saltuser.exception.NotFoundException;
import za.ac.salt.saltuser.exception.SaltUserException;
import za.ac.salt.saltuser.user.SaltUser;
import za.ac.salt.saltuser.user.SaltUserService;

import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * A security facade bean that exposes the permissions of the current user to Spring Security's method security
 * expressions, for example {@code @PreAuthorize("@proposalSecurity.mayEditProposal(#proposalCode)")}.
 * <p>
 * Every method either returns {@code true} or throws an {@link AccessDeniedException}. Within a web request the
 * current user is resolved once and kept as a request attribute, so that all checks of the request share the
 * user's cached board membership and viewable proposals. Outside a request the user is resolved for every check.
 */
@Component("proposalSecurity")
@RequiredArgsConstructor
public class ProposalSecurity {

    static final String CURRENT_USER_ATTRIBUTE = ProposalSecurity.class.getName() + ".currentUser";

    private final SaltUserService saltUserService;

    public boolean mayViewProposal(String proposalCode) {
        return check(user -> user.mayViewProposal(proposalCode), "view proposal " + proposalCode);
    }

    public boolean mayEditProposal(String proposalCode) {
        return check(user -> user.mayEditProposal(proposalCode), "edit proposal " + proposalCode);
    }

    /**
     * Checks whether the current user may view a block. A block which doesn't exist is treated like a block the
     * user may not view.
     */
    public boolean mayViewBlock(long blockId) {
        return check(user -> blockPermission(() -> user.mayViewBlock(blockId)), "view block " + blockId);
    }

    /**
     * Checks whether the current user may edit a block. A block which doesn't exist is treated like a block the
     * user may not edit.
     */
    public boolean mayEditBlock(long blockId) {
        return check(user -> blockPermission(() -> user.mayEditBlock(blockId)), "edit block " + blockId);
    }

    public boolean isAdmin() {
        return check(SaltUser::isAdmin, "perform administrative actions");
    }

    private boolean check(Predicate<SaltUser> permission, String description) {
        SaltUser user = currentUser();
        if (!permission.test(user)) {
            throw new AccessDeniedException("User " + user.getUserId() + " is not allowed to " + description);
        }
        return true;
    }

    private SaltUser currentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null) {
            throw new AccessDeniedException("User is not authenticated");
        }
        RequestAttributes requestAttributes = RequestContextHolder.getRequestAttributes();
        if (requestAttributes == null) {
            return resolve(authentication);
        }
        if (requestAttributes.getAttribute(CURRENT_USER_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST) instanceof RequestUser requestUser
                && requestUser.authentication() == authentication) {
            return requestUser.user();
        }
        SaltUser user = resolve(authentication);
        requestAttributes.setAttribute(CURRENT_USER_ATTRIBUTE, new RequestUser(authentication, user), RequestAttributes.SCOPE_REQUEST);
        return user;
    }

    private SaltUser resolve(Authentication authentication) {
        try {
            if (authentication.getPrincipal() instanceof PiptUserPrincipal principal) {
                return saltUserService.resolve(principal.userId());
            }
            return saltUserService.resolveByUsername(authentication.getName());
        } catch (SaltUserException e) {
            throw new AccessDeniedException("Unknown user " + authentication.getName(), e);
        }
    }

    private static boolean blockPermission(BooleanSupplier blockCheck) {
        try {
            return blockCheck.getAsBoolean();
        } catch (NotFoundException e) {
            throw new AccessDeniedException("Block not found", e);
        }
    }

    // the authentication the user was resolved for, in case it changes during the request
    private record RequestUser(Authentication authentication, SaltUser user) {
    }
}
