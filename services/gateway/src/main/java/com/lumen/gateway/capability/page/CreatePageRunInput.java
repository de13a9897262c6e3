package com.lumen.gateway.capability.page;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param titlePrompt what the page should be about
 * @param codeSourceId repository source to ground the page in, may be null
 * @param docSourceIds document sources to ground the page in
 */
public record CreatePageRunInput(@NotBlank @Size(max = 1024) String titlePrompt, String codeSourceId, List<String> docSourceIds) {

    public CreatePageRunInput {
        docSourceIds = docSourceIds == null ? List.of() : List.copyOf(docSourceIds);
    }
}
