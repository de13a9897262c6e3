package com.lumen.gateway.capability.thread;

import com.lumen.pagination.FetchWindow;
import com.lumen.security.AuthorizedUser;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

public interface ThreadService {

    Optional<ChatThread> get(String id);

    /**
     * @param ids       null or empty for every thread
     * @param ephemeral null for both ephemeral and persisted threads
     */
    List<ChatThread> list(List<String> ids, Boolean ephemeral, FetchWindow window);

    List<ChatThread> listOwned(String userId, FetchWindow window);

    List<Message> listMessages(String threadId, FetchWindow window);

    /**
     * Creates an ephemeral thread together with its first user message.
     *
     * @return the new thread id
     */
    String create(String userId, CreateThreadInput input);

    void appendUserMessage(String threadId, CreateMessageInput input);

    /**
     * Answers the last user message of the thread.
     *
     * @param yieldLastUserMessage whether to start the stream with {@link ThreadRunEvent.UserMessageCreated}
     * @param yieldThreadCreated   whether to start the stream with {@link ThreadRunEvent.ThreadCreated}
     */
    Flux<ThreadRunEvent> createRun(
            AuthorizedUser user,
            String threadId,
            ThreadRunOptions options,
            boolean yieldLastUserMessage,
            boolean yieldThreadCreated);

    void delete(String id);

    void deleteMessagePair(String threadId, String userMessageId, String assistantMessageId);

    void setPersisted(String id);

    void updateMessage(UpdateMessageInput input);
}
