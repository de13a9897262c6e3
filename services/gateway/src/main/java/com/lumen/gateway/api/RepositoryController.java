package com.lumen.gateway.api;

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
import com.lumen.gateway.operation.PageArguments;
import com.lumen.gateway.operation.RepositoryOperations;
import com.lumen.pagination.Connection;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class RepositoryController {

    private final RepositoryOperations operations;

    public RepositoryController(RepositoryOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/git-repositories")
    public Connection<GitRepository> gitRepositories(
            RequestContext ctx, @RequestParam(required = false) List<String> ids, PageArguments page) {
        return operations.gitRepositories(ctx, ids, page);
    }

    @PostMapping("/git-repositories")
    public String createGitRepository(RequestContext ctx, @RequestBody GitRepositoryInput input) {
        return operations.createGitRepository(ctx, input);
    }

    @PutMapping("/git-repositories/{id}")
    public boolean updateGitRepository(RequestContext ctx, @PathVariable String id, @RequestBody GitRepositoryInput input) {
        return operations.updateGitRepository(ctx, id, input);
    }

    @DeleteMapping("/git-repositories/{id}")
    public boolean deleteGitRepository(RequestContext ctx, @PathVariable String id) {
        return operations.deleteGitRepository(ctx, id);
    }

    @GetMapping("/integrations")
    public Connection<Integration> integrations(
            RequestContext ctx,
            @RequestParam(required = false) List<String> ids,
            @RequestParam(required = false) IntegrationKind kind,
            PageArguments page) {
        return operations.integrations(ctx, ids, kind, page);
    }

    @PostMapping("/integrations")
    public String createIntegration(RequestContext ctx, @RequestBody IntegrationInput input) {
        return operations.createIntegration(ctx, input);
    }

    @DeleteMapping("/integrations/{kind}/{id}")
    public boolean deleteIntegration(RequestContext ctx, @PathVariable IntegrationKind kind, @PathVariable String id) {
        return operations.deleteIntegration(ctx, id, kind);
    }

    @GetMapping("/repositories")
    public List<Repository> repositoryList(RequestContext ctx) {
        return operations.repositoryList(ctx);
    }

    @GetMapping("/repositories/{kind}/{id}/files")
    public List<FileEntry> repositorySearch(
            RequestContext ctx,
            @PathVariable RepositoryKind kind,
            @PathVariable String id,
            @RequestParam(required = false) String rev,
            @RequestParam(defaultValue = "") String pattern) {
        return operations.repositorySearch(ctx, kind, id, rev, pattern);
    }

    @GetMapping("/repositories/{kind}/{id}/grep")
    public List<GrepFile> repositoryGrep(
            RequestContext ctx,
            @PathVariable RepositoryKind kind,
            @PathVariable String id,
            @RequestParam(required = false) String rev,
            @RequestParam String query) {
        return operations.repositoryGrep(ctx, kind, id, rev, query);
    }
}
