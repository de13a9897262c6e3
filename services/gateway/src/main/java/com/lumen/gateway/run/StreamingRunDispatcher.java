package com.lumen.gateway.run;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.page.CreatePageRunInput;
import com.lumen.gateway.capability.page.CreatePageSectionRunInput;
import com.lumen.gateway.capability.page.CreateThreadToPageRunInput;
import com.lumen.gateway.capability.page.Page;
import com.lumen.gateway.capability.page.PageRunEvent;
import com.lumen.gateway.capability.page.PageService;
import com.lumen.gateway.capability.thread.ChatThread;
import com.lumen.gateway.capability.thread.CreateThreadAndRunInput;
import com.lumen.gateway.capability.thread.CreateThreadRunInput;
import com.lumen.gateway.capability.thread.ThreadRunEvent;
import com.lumen.gateway.capability.thread.ThreadService;
import com.lumen.gateway.config.GatewayProperties;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.observability.CorrelationContext;
import com.lumen.observability.CorrelationContextHolder;
import com.lumen.observability.MetricFactory;
import com.lumen.security.AuthorizedUser;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Starts generative runs.
 * <p>
 * Every subscription follows the same steps: guard, validate, perform the persistent mutation
 * synchronously, then hand back a {@link StreamingRun}. A failure in any of the first three steps
 * is thrown to the caller and no stream exists. Once the stream is returned the mutation is
 * committed, so a subscriber that disconnects early still leaves the thread or page behind.
 * <p>
 * Events travel from the capability to the subscriber through a buffer of
 * {@code lumen.gateway.streaming.buffer-size} items; a slow subscriber holds back the producer
 * rather than growing the buffer.
 */
@Service
public class StreamingRunDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StreamingRunDispatcher.class);

    private final InputValidator validator;
    private final int bufferSize;
    private final Scheduler scheduler;
    private final Counter started;
    private final Counter cancelled;

    @Autowired
    public StreamingRunDispatcher(InputValidator validator, GatewayProperties properties, MetricFactory metrics) {
        this(validator, properties, metrics, Schedulers.boundedElastic());
    }

    StreamingRunDispatcher(
            InputValidator validator, GatewayProperties properties, MetricFactory metrics, Scheduler scheduler) {
        this.validator = validator;
        this.bufferSize = properties.streaming().bufferSize();
        this.scheduler = scheduler;
        this.started = metrics.counter("lumen.runs.started", "Generative runs handed to a subscriber");
        this.cancelled = metrics.counter("lumen.runs.cancelled", "Generative runs cancelled by their subscriber");
    }

    /** Creates an ephemeral thread with its first user message and answers it. */
    public StreamingRun<ThreadRunEvent> createThreadAndRun(RequestContext ctx, CreateThreadAndRunInput input) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        validator.validate(input);
        ThreadService threads = ctx.services().thread();

        String threadId = threads.create(user.id(), input.thread());
        log.info("Created thread {} for user {}", threadId, user.id());
        return open("createThreadAndRun", threadId, user,
                threads.createRun(user, threadId, input.options(), true, true));
    }

    /** Appends a user message to an owned thread and answers it. */
    public StreamingRun<ThreadRunEvent> createThreadRun(RequestContext ctx, CreateThreadRunInput input) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        validator.validate(input);
        ThreadService threads = ctx.services().thread();

        ChatThread thread = threads.get(input.threadId())
                .orElseThrow(() -> CoreException.notFound("Thread not found"));
        if (!user.id().equals(thread.userId())) {
            throw CoreException.forbidden("You must be the thread owner to create a run");
        }
        threads.appendUserMessage(thread.id(), input.additionalUserMessage());
        return open("createThreadRun", thread.id(), user,
                threads.createRun(user, thread.id(), input.options(), true, false));
    }

    public StreamingRun<PageRunEvent> createPageRun(RequestContext ctx, CreatePageRunInput input) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(input);

        String pageId = pages.create(user.id(), input);
        log.info("Created page {} for user {}", pageId, user.id());
        return open("createPageRun", pageId, user, pages.generatePage(user, pageId, input));
    }

    /** Turns a readable thread into a page. */
    public StreamingRun<PageRunEvent> createThreadToPageRun(RequestContext ctx, CreateThreadToPageRunInput input) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(input);

        ChatThread thread = ctx.services().thread().get(input.threadId())
                .orElseThrow(() -> CoreException.notFound("Thread not found"));
        user.policy().checkReadThread(thread.userId(), thread.ephemeral());
        String pageId = pages.createFromThread(user.id(), thread.id());
        log.info("Created page {} from thread {} for user {}", pageId, thread.id(), user.id());
        return open("createThreadToPageRun", pageId, user, pages.generatePageFromThread(user, pageId, thread.id()));
    }

    /** Appends a section to a page the caller authored and generates its content. */
    public StreamingRun<PageRunEvent> createPageSectionRun(RequestContext ctx, CreatePageSectionRunInput input) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(input);

        Page page = pages.get(input.pageId()).orElseThrow(() -> CoreException.notFound("Page not found"));
        user.policy().checkUpdatePage(page.authorId());
        String sectionId = pages.appendSection(page.id(), input.titlePrompt());
        return open("createPageSectionRun", sectionId, user, pages.generateSection(user, sectionId));
    }

    private <E> StreamingRun<E> open(String operation, String resourceId, AuthorizedUser user, Flux<E> source) {
        CorrelationContext correlation = CorrelationContextHolder.get()
                .orElseGet(() -> CorrelationContext.of(UUID.randomUUID().toString()))
                .withUser(user.id())
                .withOperation(operation);
        started.increment();

        Flux<E> events = source
                .publishOn(scheduler, bufferSize)
                .doOnCancel(CorrelationContextHolder.bind(correlation, () -> {
                    cancelled.increment();
                    log.info("Subscriber left run {}, stopped streaming", resourceId);
                }))
                .doOnError(e -> CorrelationContextHolder.runWithContext(correlation,
                        () -> log.warn("Run {} failed: {}", resourceId, e.getMessage())))
                .doOnComplete(CorrelationContextHolder.bind(correlation,
                        () -> log.debug("Run {} completed", resourceId)));
        return new StreamingRun<>(resourceId, events);
    }
}
