package com.lumen.gateway.capability;

import com.lumen.gateway.capability.analytic.AnalyticService;
import com.lumen.gateway.capability.analytic.UserEventService;
import com.lumen.gateway.capability.auth.AuthenticationService;
import com.lumen.gateway.capability.email.EmailService;
import com.lumen.gateway.capability.job.JobService;
import com.lumen.gateway.capability.license.LicenseService;
import com.lumen.gateway.capability.model.ChatModel;
import com.lumen.gateway.capability.model.CompletionModel;
import com.lumen.gateway.capability.model.EmbeddingModel;
import com.lumen.gateway.capability.page.PageService;
import com.lumen.gateway.capability.repository.IntegrationService;
import com.lumen.gateway.capability.repository.RepositoryService;
import com.lumen.gateway.capability.setting.SettingService;
import com.lumen.gateway.capability.thread.ThreadService;
import com.lumen.gateway.capability.usergroup.AccessPolicyService;
import com.lumen.gateway.capability.usergroup.UserGroupService;

import java.util.Objects;
import java.util.Optional;

/**
 * Every domain service the gateway dispatches to. Composed once at startup and shared read-only
 * by all requests.
 */
public record ServiceLocator(
        AuthenticationService auth,
        LicenseService license,
        EmailService email,
        SettingService setting,
        RepositoryService repository,
        IntegrationService integration,
        JobService job,
        AnalyticService analytic,
        UserEventService userEvent,
        ThreadService thread,
        Optional<PageService> page,
        UserGroupService userGroup,
        AccessPolicyService accessPolicy,
        Optional<ChatModel> chat,
        Optional<CompletionModel> completion,
        EmbeddingModel embedding) {

    public ServiceLocator {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(license, "license");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(setting, "setting");
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(integration, "integration");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(analytic, "analytic");
        Objects.requireNonNull(userEvent, "userEvent");
        Objects.requireNonNull(thread, "thread");
        Objects.requireNonNull(userGroup, "userGroup");
        Objects.requireNonNull(accessPolicy, "accessPolicy");
        Objects.requireNonNull(embedding, "embedding");
        page = page == null ? Optional.empty() : page;
        chat = chat == null ? Optional.empty() : chat;
        completion = completion == null ? Optional.empty() : completion;
    }
}
