package com.lumen.gateway.capability.thread;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * @param content     user prompt
 * @param attachments code snippets the user attached to the prompt
 */
public record CreateMessageInput(@NotBlank String content, List<@Valid CodeAttachment> attachments) {

    public CreateMessageInput {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public record CodeAttachment(String filepath, @NotBlank String content) {
    }
}
