package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.repository.FileEntry;
import com.lumen.gateway.capability.repository.IntegrationInput;
import com.lumen.gateway.capability.repository.IntegrationKind;
import com.lumen.gateway.capability.repository.Repository;
import com.lumen.gateway.capability.repository.RepositoryKind;
import com.lumen.gateway.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RepositoryOperations")
class RepositoryOperationsTest {

    private final TestServices services = new TestServices();
    private final RepositoryOperations operations = new RepositoryOperations(InputValidator.withDefaultProvider());

    private final Repository open = new Repository("r1", "src-open", "open", RepositoryKind.GIT, "https://git/open", List.of("main"));
    private final Repository restricted = new Repository("r2", "src-secret", "secret", RepositoryKind.GITHUB, "https://git/secret", List.of("main"));

    @BeforeEach
    void setUp() {
        services.user("bob", false);
        services.user("root", true);
        when(services.repository.listAll()).thenReturn(List.of(open, restricted));
        when(services.repository.find(RepositoryKind.GIT, "r1")).thenReturn(Optional.of(open));
        when(services.repository.find(RepositoryKind.GITHUB, "r2")).thenReturn(Optional.of(restricted));
        when(services.accessPolicy.canRead("src-open", "bob")).thenReturn(true);
        when(services.accessPolicy.canRead("src-secret", "bob")).thenReturn(false);
    }

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Test
    @DisplayName("repositoryList hides unreadable sources")
    void listFiltered() {
        assertThat(operations.repositoryList(services.as("bob"))).containsExactly(open);
        assertThat(operations.repositoryList(services.asAdmin("root"))).containsExactly(open, restricted);
    }

    @Test
    @DisplayName("auth-token callers list repositories under the same source policy")
    void listWithAuthToken() {
        assertThat(operations.repositoryList(services.withAuthToken("bob"))).containsExactly(open);
    }

    @Test
    @DisplayName("auth-token callers cannot search repositories")
    void searchRejectsAuthToken() {
        assertThatThrownBy(() -> operations.repositorySearch(services.withAuthToken("bob"), RepositoryKind.GIT, "r1", null, "main"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    @DisplayName("searching an unreadable repository looks like a missing one")
    void hiddenIsNotFound() {
        assertThatThrownBy(() -> operations.repositorySearch(services.as("bob"), RepositoryKind.GITHUB, "r2", null, "main"))
                .hasMessage("Repository not found")
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.NOT_FOUND));
        verify(services.repository, never()).searchFiles(any(), any(), any(), anyInt());
    }

    @Test
    @DisplayName("searching a readable repository returns its files")
    void search() {
        var entry = new FileEntry("file", "src/main.rs", List.of(4, 5));
        when(services.repository.searchFiles(open, null, "main", RepositoryOperations.SEARCH_TOP_N)).thenReturn(List.of(entry));

        assertThat(operations.repositorySearch(services.as("bob"), RepositoryKind.GIT, "r1", null, "main")).containsExactly(entry);
    }

    @Test
    @DisplayName("self-hosted integrations need an API base")
    void selfHostedNeedsApiBase() {
        var input = new IntegrationInput(IntegrationKind.GITLAB_SELF_HOSTED, "GitLab", "glpat-x", null);

        assertThatThrownBy(() -> operations.createIntegration(services.asAdmin("root"), input))
                .satisfies(t -> assertThat(((CoreException) t).violations()).extracting("path").containsExactly("apiBase"));
    }

    @Test
    @DisplayName("members cannot register git repositories")
    void membersCannotRegister() {
        assertThatThrownBy(() -> operations.deleteGitRepository(services.as("bob"), "g1"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
        verify(services.repository, never()).deleteGitRepository(any());
    }
}
