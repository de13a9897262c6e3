package com.lumen.gateway.capability.page;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePageSectionRunInput(@NotBlank String pageId, @NotBlank @Size(max = 1024) String titlePrompt) {
}
