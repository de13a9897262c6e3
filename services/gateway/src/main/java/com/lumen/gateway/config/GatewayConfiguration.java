package com.lumen.gateway.config;

import com.lumen.errors.ErrorTranslator;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.ServiceLocator;
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
import com.lumen.gateway.context.PrincipalResolver;
import com.lumen.observability.MetricFactory;
import com.lumen.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

/**
 * Composes the gateway from the capability beans present in the context.
 */
@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GatewayProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public ErrorTranslator errorTranslator(SensitiveDataRedactor redactor) {
        return new ErrorTranslator(redactor);
    }

    @Bean
    public InputValidator inputValidator(Validator validator) {
        return new InputValidator(validator);
    }

    /**
     * The page service is wired only when {@code lumen.gateway.features.pages-enabled} is set.
     * Chat and completion models are wired when present.
     */
    @Bean
    public ServiceLocator serviceLocator(
            GatewayProperties properties,
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
            ObjectProvider<PageService> page,
            UserGroupService userGroup,
            AccessPolicyService accessPolicy,
            ObjectProvider<ChatModel> chat,
            ObjectProvider<CompletionModel> completion,
            EmbeddingModel embedding) {
        Optional<PageService> pages = properties.features().pagesEnabled()
                ? Optional.ofNullable(page.getIfAvailable())
                : Optional.empty();
        if (properties.features().pagesEnabled() && pages.isEmpty()) {
            log.warn("Pages are enabled but no PageService is available, page operations will be rejected");
        }
        ServiceLocator locator = new ServiceLocator(auth, license, email, setting, repository, integration, job,
                analytic, userEvent, thread, pages, userGroup, accessPolicy,
                Optional.ofNullable(chat.getIfAvailable()), Optional.ofNullable(completion.getIfAvailable()),
                embedding);
        log.info("Service locator ready: pages={}, chat={}, completion={}",
                locator.page().isPresent(), locator.chat().isPresent(), locator.completion().isPresent());
        return locator;
    }

    @Bean
    public PrincipalResolver principalResolver(ServiceLocator services) {
        return new PrincipalResolver(services);
    }
}
