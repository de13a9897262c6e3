package com.lumen.gateway.api;

import com.lumen.gateway.capability.thread.ChatThread;
import com.lumen.gateway.capability.thread.CreateMessageInput;
import com.lumen.gateway.capability.thread.CreateThreadAndRunInput;
import com.lumen.gateway.capability.thread.CreateThreadRunInput;
import com.lumen.gateway.capability.thread.Message;
import com.lumen.gateway.capability.thread.ThreadRunEvent;
import com.lumen.gateway.capability.thread.ThreadRunOptions;
import com.lumen.gateway.capability.thread.UpdateMessageInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.infrastructure.web.RunEventStreams;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.gateway.operation.ThreadOperations;
import com.lumen.gateway.run.StreamingRunDispatcher;
import com.lumen.pagination.Connection;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Threads and their runs. Runs are streamed as server-sent events; the thread id is the event id.
 */
@RestController
@RequestMapping("/api/v1/threads")
public class ThreadController {

    private final ThreadOperations operations;
    private final StreamingRunDispatcher dispatcher;
    private final RunEventStreams streams;

    public ThreadController(ThreadOperations operations, StreamingRunDispatcher dispatcher, RunEventStreams streams) {
        this.operations = operations;
        this.dispatcher = dispatcher;
        this.streams = streams;
    }

    @GetMapping
    public Connection<ChatThread> threads(
            RequestContext ctx,
            @RequestParam(required = false) List<String> ids,
            @RequestParam(required = false) Boolean ephemeral,
            PageArguments page) {
        return operations.threads(ctx, ids, ephemeral, page);
    }

    @GetMapping("/mine")
    public Connection<ChatThread> myThreads(RequestContext ctx, PageArguments page) {
        return operations.myThreads(ctx, page);
    }

    @GetMapping("/{threadId}/messages")
    public Connection<Message> threadMessages(RequestContext ctx, @PathVariable String threadId, PageArguments page) {
        return operations.threadMessages(ctx, threadId, page);
    }

    @DeleteMapping("/{threadId}")
    public boolean deleteThread(RequestContext ctx, @PathVariable String threadId) {
        return operations.deleteThread(ctx, threadId);
    }

    @DeleteMapping("/{threadId}/messages/{userMessageId}/{assistantMessageId}")
    public boolean deleteThreadMessagePair(
            RequestContext ctx,
            @PathVariable String threadId,
            @PathVariable String userMessageId,
            @PathVariable String assistantMessageId) {
        return operations.deleteThreadMessagePair(ctx, threadId, userMessageId, assistantMessageId);
    }

    @PostMapping("/{threadId}/persist")
    public boolean setThreadPersisted(RequestContext ctx, @PathVariable String threadId) {
        return operations.setThreadPersisted(ctx, threadId);
    }

    @PutMapping("/{threadId}/messages/{messageId}")
    public boolean updateThreadMessage(
            RequestContext ctx,
            @PathVariable String threadId,
            @PathVariable String messageId,
            @RequestBody ContentRequest request) {
        return operations.updateThreadMessage(ctx, new UpdateMessageInput(messageId, threadId, request.content()));
    }

    @PostMapping("/runs")
    public Flux<ServerSentEvent<Object>> createThreadAndRun(
            RequestContext ctx, @RequestBody CreateThreadAndRunInput input) {
        return streams.toSse(dispatcher.createThreadAndRun(ctx, input), ThreadRunEvent::type);
    }

    @PostMapping("/{threadId}/runs")
    public Flux<ServerSentEvent<Object>> createThreadRun(
            RequestContext ctx, @PathVariable String threadId, @RequestBody ThreadRunRequest request) {
        CreateThreadRunInput input = new CreateThreadRunInput(threadId, request.additionalUserMessage(), request.options());
        return streams.toSse(dispatcher.createThreadRun(ctx, input), ThreadRunEvent::type);
    }

    public record ContentRequest(String content) {
    }

    public record ThreadRunRequest(CreateMessageInput additionalUserMessage, ThreadRunOptions options) {
    }
}
