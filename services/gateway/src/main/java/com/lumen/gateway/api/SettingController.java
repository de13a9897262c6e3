package com.lumen.gateway.api;

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
import com.lumen.gateway.operation.SettingOperations;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Unset settings are answered with 204 No Content.
 */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingController {

    private final SettingOperations operations;

    public SettingController(SettingOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/email")
    public ResponseEntity<EmailSetting> emailSetting(RequestContext ctx) {
        return okOrNoContent(operations.emailSetting(ctx));
    }

    @PutMapping("/email")
    public boolean updateEmailSetting(RequestContext ctx, @RequestBody EmailSettingInput input) {
        return operations.updateEmailSetting(ctx, input);
    }

    @DeleteMapping("/email")
    public boolean deleteEmailSetting(RequestContext ctx) {
        return operations.deleteEmailSetting(ctx);
    }

    @GetMapping("/network")
    public NetworkSetting networkSetting(RequestContext ctx) {
        return operations.networkSetting(ctx);
    }

    @PutMapping("/network")
    public boolean updateNetworkSetting(RequestContext ctx, @RequestBody NetworkSettingInput input) {
        return operations.updateNetworkSetting(ctx, input);
    }

    @GetMapping("/security")
    public SecuritySetting securitySetting(RequestContext ctx) {
        return operations.securitySetting(ctx);
    }

    @PutMapping("/security")
    public boolean updateSecuritySetting(RequestContext ctx, @RequestBody SecuritySettingInput input) {
        return operations.updateSecuritySetting(ctx, input);
    }

    @GetMapping("/ldap")
    public ResponseEntity<LdapCredential> ldapCredential(RequestContext ctx) {
        return okOrNoContent(operations.ldapCredential(ctx));
    }

    @PutMapping("/ldap")
    public boolean updateLdapCredential(RequestContext ctx, @RequestBody LdapCredentialInput input) {
        return operations.updateLdapCredential(ctx, input);
    }

    @DeleteMapping("/ldap")
    public boolean deleteLdapCredential(RequestContext ctx) {
        return operations.deleteLdapCredential(ctx);
    }

    @GetMapping("/oauth/{provider}")
    public ResponseEntity<OAuthCredential> oauthCredential(RequestContext ctx, @PathVariable OAuthProvider provider) {
        return okOrNoContent(operations.oauthCredential(ctx, provider));
    }

    @PutMapping("/oauth")
    public boolean updateOAuthCredential(RequestContext ctx, @RequestBody OAuthCredentialInput input) {
        return operations.updateOAuthCredential(ctx, input);
    }

    @DeleteMapping("/oauth/{provider}")
    public boolean deleteOAuthCredential(RequestContext ctx, @PathVariable OAuthProvider provider) {
        return operations.deleteOAuthCredential(ctx, provider);
    }

    private static <T> ResponseEntity<T> okOrNoContent(Optional<T> value) {
        return value.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }
}
