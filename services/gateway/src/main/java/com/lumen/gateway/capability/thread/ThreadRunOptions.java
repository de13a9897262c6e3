package com.lumen.gateway.capability.thread;

import java.util.List;

/**
 * Retrieval switches for one assistant turn.
 *
 * @param codeSourceId repository source to search, null to skip code search
 * @param docSourceIds document sources to search
 * @param generateRelevantQuestions whether to suggest follow-up questions
 */
public record ThreadRunOptions(String codeSourceId, List<String> docSourceIds, boolean generateRelevantQuestions) {

    public ThreadRunOptions {
        docSourceIds = docSourceIds == null ? List.of() : List.copyOf(docSourceIds);
    }

    public static ThreadRunOptions defaults() {
        return new ThreadRunOptions(null, List.of(), false);
    }
}
