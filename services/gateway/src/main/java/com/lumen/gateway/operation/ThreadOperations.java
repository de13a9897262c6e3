package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.thread.ChatThread;
import com.lumen.gateway.capability.thread.Message;
import com.lumen.gateway.capability.thread.UpdateMessageInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import com.lumen.security.AuthorizedUser;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Thread queries and mutations. Runs are started through
 * {@link com.lumen.gateway.run.StreamingRunDispatcher}.
 * <p>
 * A missing thread is NOT_FOUND; an existing thread the caller may not touch is FORBIDDEN.
 */
@Service
public class ThreadOperations {

    private final InputValidator validator;

    public ThreadOperations(InputValidator validator) {
        this.validator = validator;
    }

    /**
     * @throws CoreException FORBIDDEN when any thread of the page is unreadable by the caller
     */
    public Connection<ChatThread> threads(RequestContext ctx, List<String> ids, Boolean ephemeral, PageArguments page) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        Connection<ChatThread> threads = ConnectionBuilder.query(page.window(),
                window -> ctx.services().thread().list(ids, ephemeral, window));
        for (ChatThread thread : threads.nodes()) {
            user.policy().checkReadThread(thread.userId(), thread.ephemeral());
        }
        return threads;
    }

    public Connection<ChatThread> myThreads(RequestContext ctx, PageArguments page) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        return ConnectionBuilder.query(page.window(),
                window -> ctx.services().thread().listOwned(user.id(), window));
    }

    public Connection<Message> threadMessages(RequestContext ctx, String threadId, PageArguments page) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        ChatThread thread = existingThread(ctx, threadId);
        user.policy().checkReadThread(thread.userId(), thread.ephemeral());
        return ConnectionBuilder.query(page.window(),
                window -> ctx.services().thread().listMessages(thread.id(), window));
    }

    public boolean deleteThread(RequestContext ctx, String id) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        ChatThread thread = existingThread(ctx, id);
        user.policy().checkDeleteThread(thread.userId());
        ctx.services().thread().delete(thread.id());
        return true;
    }

    public boolean deleteThreadMessagePair(
            RequestContext ctx, String threadId, String userMessageId, String assistantMessageId) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        ChatThread thread = existingThread(ctx, threadId);
        user.policy().checkDeleteThreadMessages(thread.userId());
        ctx.services().thread().deleteMessagePair(thread.id(), userMessageId, assistantMessageId);
        return true;
    }

    public boolean setThreadPersisted(RequestContext ctx, String threadId) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        ChatThread thread = existingThread(ctx, threadId);
        user.policy().checkUpdateThreadPersistence(thread.userId());
        ctx.services().thread().setPersisted(thread.id());
        return true;
    }

    public boolean updateThreadMessage(RequestContext ctx, UpdateMessageInput input) {
        AuthorizedUser user = Guards.user(ctx);
        validator.validate(input);
        ChatThread thread = existingThread(ctx, input.threadId());
        user.policy().checkUpdateThreadMessage(thread.userId());
        ctx.services().thread().updateMessage(input);
        return true;
    }

    static ChatThread existingThread(RequestContext ctx, String threadId) {
        return ctx.services().thread().get(threadId)
                .orElseThrow(() -> CoreException.notFound("Thread not found"));
    }
}
