package com.lumen.gateway.capability.repository;

import com.lumen.pagination.FetchWindow;

import java.util.List;

public interface IntegrationService {

    /**
     * @param kind null lists integrations of every kind
     */
    List<Integration> list(List<String> ids, IntegrationKind kind, FetchWindow window);

    String create(IntegrationInput input);

    void delete(String id, IntegrationKind kind);
}
