package com.lumen.gateway.capability.repository;

import com.lumen.pagination.FetchWindow;

import java.util.List;
import java.util.Optional;

public interface RepositoryService {

    List<GitRepository> listGitRepositories(List<String> ids, FetchWindow window);

    String createGitRepository(String name, String gitUrl);

    void updateGitRepository(String id, String name, String gitUrl);

    void deleteGitRepository(String id);

    /** Every repository of every kind, without access filtering. */
    List<Repository> listAll();

    Optional<Repository> find(RepositoryKind kind, String id);

    List<FileEntry> searchFiles(Repository repository, String rev, String pattern, int topN);

    List<GrepFile> grep(Repository repository, String rev, String query);
}
