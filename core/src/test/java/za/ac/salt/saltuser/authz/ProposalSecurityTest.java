package za.ac.salt.saltuser.authz;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import za.ac.salt.saltuser.authn.PiptUserPrincipal;
import za.ac.salt.saltuser.exception.AmbiguousIdentityException;
import za.ac.salt.saltuser.exception.NotFoundException;
import za.ac.salt.saltuser.user.SaltUser;
import za.ac.salt.saltuser.user.SaltUserService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProposalSecurityTest {

    private final SaltUserService saltUserService = mock();
    private final SaltUser saltUser = mock();
    private final ProposalSecurity proposalSecurity = new ProposalSecurity(saltUserService);

    private final Authentication authentication = new TestingAuthenticationToken("pi007", "password");

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void mayViewProposal_WhenAllowed_ReturnsTrue() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.mayViewProposal("2023-1-SCI-007")).thenReturn(true);

        // When
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));
    }

    @Test
    void mayEditProposal_WhenNotAllowed_ThrowsAccessDenied() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.getUserId()).thenReturn(3L);

        // When
        AccessDeniedException exception = assertThrows(AccessDeniedException.class, () -> proposalSecurity.mayEditProposal("2023-1-SCI-042"));
        assertEquals("User 3 is not allowed to edit proposal 2023-1-SCI-042", exception.getMessage());
    }

    @Test
    void isAdmin_WhenNotAuthenticated_ThrowsAccessDenied() {
        AccessDeniedException exception = assertThrows(AccessDeniedException.class, () -> proposalSecurity.isAdmin());
        assertEquals("User is not authenticated", exception.getMessage());
        verifyNoInteractions(saltUserService);
    }

    @Test
    void isAdmin_WhenAdministrator_ReturnsTrue() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.isAdmin()).thenReturn(true);

        // When
        assertTrue(proposalSecurity.isAdmin());
    }

    @Test
    void mayViewProposal_WithUnknownUser_ThrowsAccessDenied() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenThrow(new NotFoundException("The username does not exist: pi007"));

        // When
        AccessDeniedException exception = assertThrows(AccessDeniedException.class, () -> proposalSecurity.mayViewProposal("2023-1-SCI-007"));
        assertEquals("Unknown user pi007", exception.getMessage());
        assertInstanceOf(NotFoundException.class, exception.getCause());
    }

    @Test
    void mayViewProposal_WithAmbiguousUser_ThrowsAccessDenied() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenThrow(new AmbiguousIdentityException("The username pi007 belongs to 2 users: [3, 4]"));

        // When
        assertThrows(AccessDeniedException.class, () -> proposalSecurity.mayViewProposal("2023-1-SCI-007"));
    }

    @Test
    void mayEditBlock_WithUnknownBlock_ThrowsAccessDenied() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.mayEditBlock(5)).thenThrow(new NotFoundException("There exists no block with id 5"));

        // When
        AccessDeniedException exception = assertThrows(AccessDeniedException.class, () -> proposalSecurity.mayEditBlock(5));
        assertEquals("Block not found", exception.getMessage());
    }

    @Test
    void mayViewBlock_WhenAllowed_ReturnsTrue() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.mayViewBlock(200)).thenReturn(true);

        // When
        assertTrue(proposalSecurity.mayViewBlock(200));
    }

    @Test
    void mayViewProposal_WithPiptPrincipal_ResolvesById() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(new TestingAuthenticationToken(new PiptUserPrincipal(3, "pi007"), null));
        when(saltUserService.resolve(3)).thenReturn(saltUser);
        when(saltUser.mayViewProposal("2023-1-SCI-007")).thenReturn(true);

        // When
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));
        verify(saltUserService, never()).resolveByUsername(any());
    }

    @Test
    void checks_WithinRequest_ResolveUserOnce() {
        // Given
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest()));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.mayViewProposal("2023-1-SCI-007")).thenReturn(true);
        when(saltUser.mayViewBlock(200)).thenReturn(true);

        // When
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));
        assertTrue(proposalSecurity.mayViewBlock(200));
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));

        // Then
        verify(saltUserService, times(1)).resolveByUsername("pi007");
    }

    @Test
    void checks_InSeparateRequests_ResolveUserEachTime() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.mayViewProposal("2023-1-SCI-007")).thenReturn(true);

        // When
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest()));
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest()));
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));

        // Then
        verify(saltUserService, times(2)).resolveByUsername("pi007");
    }

    @Test
    void checks_WithinRequest_WhenAuthenticationChanges_ResolveNewUser() {
        // Given
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest()));
        SaltUser otherUser = mock();
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUserService.resolveByUsername("leader")).thenReturn(otherUser);
        when(saltUser.mayViewProposal("2023-1-SCI-007")).thenReturn(true);
        when(otherUser.getUserId()).thenReturn(1L);

        // When
        SecurityContextHolder.getContext().setAuthentication(authentication);
        assertTrue(proposalSecurity.mayViewProposal("2023-1-SCI-007"));
        SecurityContextHolder.getContext().setAuthentication(new TestingAuthenticationToken("leader", "password"));
        assertThrows(AccessDeniedException.class, () -> proposalSecurity.mayViewProposal("2023-1-SCI-007"));

        // Then
        verify(saltUserService).resolveByUsername("leader");
    }

    @Test
    void checks_OutsideRequest_ResolveUserForEveryCheck() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(authentication);
        when(saltUserService.resolveByUsername("pi007")).thenReturn(saltUser);
        when(saltUser.isAdmin()).thenReturn(true);

        // When
        assertTrue(proposalSecurity.isAdmin());
        assertTrue(proposalSecurity.isAdmin());

        // Then
        verify(saltUserService, times(2)).resolveByUsername("pi007");
    }
}
