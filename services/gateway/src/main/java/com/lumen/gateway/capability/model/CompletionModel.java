package com.lumen.gateway.capability.model;

public interface CompletionModel {

    String complete(String prompt, int maxTokens);
}
