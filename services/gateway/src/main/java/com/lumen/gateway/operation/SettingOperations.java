package com.lumen.gateway.operation;

import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.LdapCredential;
import com.lumen.gateway.capability.auth.LdapCredentialInput;
import com.lumen.gateway.capability.auth.OAuthCredential;
import com.lumen.gateway.capability.auth.OAuthCredentialInput;
import com.lumen.gateway.capability.auth.OAuthProvider;
import com.lumen.gateway.capability.email.EmailSetting;
import com.lumen.gateway.capability.email.EmailSettingInput;
import com.lumen.gateway.capability.setting.NetworkSetting;
import com.lumen.gateway.capability.setting.NetworkSettingInput;
import com.lumen.gateway.capability.setting.SecuritySetting;
import com.lumen.gateway.capability.setting.SecuritySettingInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Instance-wide settings. Every operation requires an admin; security and SSO changes also
 * require an enterprise license.
 */
@Service
public class SettingOperations {

    private final InputValidator validator;

    public SettingOperations(InputValidator validator) {
        this.validator = validator;
    }

    public Optional<EmailSetting> emailSetting(RequestContext ctx) {
        Guards.admin(ctx);
        return ctx.services().email().readSetting();
    }

    public boolean updateEmailSetting(RequestContext ctx, EmailSettingInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        ctx.services().email().updateSetting(input);
        return true;
    }

    public boolean deleteEmailSetting(RequestContext ctx) {
        Guards.admin(ctx);
        ctx.services().email().deleteSetting();
        return true;
    }

    public NetworkSetting networkSetting(RequestContext ctx) {
        Guards.admin(ctx);
        return ctx.services().setting().readNetworkSetting();
    }

    public boolean updateNetworkSetting(RequestContext ctx, NetworkSettingInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        ctx.services().setting().updateNetworkSetting(input);
        return true;
    }

    public SecuritySetting securitySetting(RequestContext ctx) {
        Guards.admin(ctx);
        return ctx.services().setting().readSecuritySetting();
    }

    public boolean updateSecuritySetting(RequestContext ctx, SecuritySettingInput input) {
        Guards.admin(ctx);
        Guards.license(ctx, Guards.ENTERPRISE);
        validator.validate(input);
        ctx.services().setting().updateSecuritySetting(input);
        return true;
    }

    public Optional<LdapCredential> ldapCredential(RequestContext ctx) {
        Guards.admin(ctx);
        return ctx.services().auth().readLdapCredential();
    }

    public boolean updateLdapCredential(RequestContext ctx, LdapCredentialInput input) {
        Guards.admin(ctx);
        Guards.license(ctx, Guards.ENTERPRISE);
        validator.validate(input);
        ctx.services().auth().updateLdapCredential(input);
        return true;
    }

    public boolean deleteLdapCredential(RequestContext ctx) {
        Guards.admin(ctx);
        ctx.services().auth().deleteLdapCredential();
        return true;
    }

    public Optional<OAuthCredential> oauthCredential(RequestContext ctx, OAuthProvider provider) {
        Guards.admin(ctx);
        return ctx.services().auth().readOAuthCredential(provider);
    }

    public boolean updateOAuthCredential(RequestContext ctx, OAuthCredentialInput input) {
        Guards.admin(ctx);
        Guards.license(ctx, Guards.ENTERPRISE);
        validator.validate(input);
        ctx.services().auth().updateOAuthCredential(input);
        return true;
    }

    public boolean deleteOAuthCredential(RequestContext ctx, OAuthProvider provider) {
        Guards.admin(ctx);
        ctx.services().auth().deleteOAuthCredential(provider);
        return true;
    }
}
