package com.lumen.gateway.run;

import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event stream of one generative run, bound to the resource it writes to.
 * <p>
 * The stream has exactly one consumer: subscribing a second time fails with
 * {@link IllegalStateException}. Cancelling the subscription stops delivery; whatever was
 * persisted before the stream was returned stays persisted.
 *
 * @param <E> event type
 */
public final class StreamingRun<E> {

    private final String resourceId;
    private final Flux<E> events;

    StreamingRun(String resourceId, Flux<E> source) {
        this.resourceId = resourceId;
        AtomicBoolean subscribed = new AtomicBoolean();
        this.events = Flux.defer(() -> subscribed.compareAndSet(false, true)
                ? source
                : Flux.error(new IllegalStateException("Run " + resourceId + " already has a subscriber")));
    }

    /** Id of the thread, page or section the run writes to; it exists before any event is emitted. */
    public String resourceId() {
        return resourceId;
    }

    public Flux<E> events() {
        return events;
    }
}
