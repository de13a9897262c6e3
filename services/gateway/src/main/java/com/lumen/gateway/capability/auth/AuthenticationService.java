package com.lumen.gateway.capability.auth;

import com.lumen.pagination.FetchWindow;
import com.lumen.security.Principal;

import java.util.List;
import java.util.Optional;

/**
 * Accounts, sessions, invitations and SSO credentials.
 */
public interface AuthenticationService {

    /**
     * Verifies a session JWT or a user auth token.
     *
     * @return the claims, or empty when the credential is invalid or expired
     */
    Optional<Principal> verifyAccessToken(String token);

    Optional<User> getUser(String id);

    List<User> listUsers(List<String> ids, FetchWindow window);

    boolean isAdminInitialized();

    TokenPair register(RegisterInput input);

    TokenPair tokenAuth(String email, String password);

    TokenPair refreshToken(String refreshToken);

    void updateUserActive(String id, boolean active);

    void updateUserRole(String id, boolean admin);

    void updateUserAvatar(String id, byte[] avatar);

    void updateUserName(String id, String name);

    void updateUserPassword(String id, String oldPassword, String newPassword);

    void resetUserAuthToken(String id);

    void logoutAllSessions(String id);

    String generateResetPasswordUrl(String id);

    void requestPasswordResetEmail(String email);

    void passwordReset(String code, String password);

    List<Invitation> listInvitations(FetchWindow window);

    String createInvitation(String email);

    String deleteInvitation(String id);

    Optional<OAuthCredential> readOAuthCredential(OAuthProvider provider);

    void updateOAuthCredential(OAuthCredentialInput input);

    void deleteOAuthCredential(OAuthProvider provider);

    Optional<LdapCredential> readLdapCredential();

    void updateLdapCredential(LdapCredentialInput input);

    void deleteLdapCredential();
}
