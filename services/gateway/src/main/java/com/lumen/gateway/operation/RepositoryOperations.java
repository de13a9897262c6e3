package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.repository.FileEntry;
import com.lumen.gateway.capability.repository.GitRepository;
import com.lumen.gateway.capability.repository.GitRepositoryInput;
import com.lumen.gateway.capability.repository.GrepFile;
import com.lumen.gateway.capability.repository.Integration;
import com.lumen.gateway.capability.repository.IntegrationInput;
import com.lumen.gateway.capability.repository.IntegrationKind;
import com.lumen.gateway.capability.repository.Repository;
import com.lumen.gateway.capability.repository.RepositoryKind;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import com.lumen.security.AuthorizedUser;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Repository registration (admin) and code search (any user, limited to readable sources).
 */
@Service
public class RepositoryOperations {

    static final int SEARCH_TOP_N = 40;

    private final InputValidator validator;

    public RepositoryOperations(InputValidator validator) {
        this.validator = validator;
    }

    public Connection<GitRepository> gitRepositories(RequestContext ctx, List<String> ids, PageArguments page) {
        Guards.admin(ctx);
        return ConnectionBuilder.query(page.window(),
                window -> ctx.services().repository().listGitRepositories(ids, window));
    }

    public String createGitRepository(RequestContext ctx, GitRepositoryInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        return ctx.services().repository().createGitRepository(input.name(), input.gitUrl());
    }

    public boolean updateGitRepository(RequestContext ctx, String id, GitRepositoryInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        ctx.services().repository().updateGitRepository(id, input.name(), input.gitUrl());
        return true;
    }

    public boolean deleteGitRepository(RequestContext ctx, String id) {
        Guards.admin(ctx);
        ctx.services().repository().deleteGitRepository(id);
        return true;
    }

    /**
     * @param kind null for integrations of every kind
     */
    public Connection<Integration> integrations(
            RequestContext ctx, List<String> ids, IntegrationKind kind, PageArguments page) {
        Guards.admin(ctx);
        return ConnectionBuilder.query(page.window(),
                window -> ctx.services().integration().list(ids, kind, window));
    }

    public String createIntegration(RequestContext ctx, IntegrationInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        if (isSelfHosted(input.kind()) && (input.apiBase() == null || input.apiBase().isBlank())) {
            throw CoreException.invalidInput("apiBase", "is required for self-hosted integrations");
        }
        return ctx.services().integration().create(input);
    }

    public boolean deleteIntegration(RequestContext ctx, String id, IntegrationKind kind) {
        Guards.admin(ctx);
        ctx.services().integration().delete(id, kind);
        return true;
    }

    public List<Repository> repositoryList(RequestContext ctx) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        return ctx.services().repository().listAll().stream()
                .filter(repository -> user.policy().canReadSource(repository.sourceId()))
                .toList();
    }

    public List<FileEntry> repositorySearch(
            RequestContext ctx, RepositoryKind kind, String id, String rev, String pattern) {
        AuthorizedUser user = Guards.user(ctx);
        Repository repository = readableRepository(ctx, user, kind, id);
        return ctx.services().repository().searchFiles(repository, rev, pattern, SEARCH_TOP_N);
    }

    public List<GrepFile> repositoryGrep(RequestContext ctx, RepositoryKind kind, String id, String rev, String query) {
        AuthorizedUser user = Guards.user(ctx);
        if (query == null || query.isBlank()) {
            throw CoreException.invalidInput("query", "must not be blank");
        }
        Repository repository = readableRepository(ctx, user, kind, id);
        return ctx.services().repository().grep(repository, rev, query);
    }

    // sources the caller cannot read are reported exactly like missing ones
    private static Repository readableRepository(
            RequestContext ctx, AuthorizedUser user, RepositoryKind kind, String id) {
        return ctx.services().repository().find(kind, id)
                .filter(repository -> user.policy().canReadSource(repository.sourceId()))
                .orElseThrow(() -> CoreException.notFound("Repository not found"));
    }

    private static boolean isSelfHosted(IntegrationKind kind) {
        return kind == IntegrationKind.GITHUB_SELF_HOSTED || kind == IntegrationKind.GITLAB_SELF_HOSTED;
    }
}
