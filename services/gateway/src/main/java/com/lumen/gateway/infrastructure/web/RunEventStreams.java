package com.lumen.gateway.infrastructure.web;

import com.lumen.errors.ErrorTranslator;
import com.lumen.gateway.run.StreamingRun;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.function.Function;

/**
 * Writes a {@link StreamingRun} as server-sent events.
 * <p>
 * Each event is named after its type. A failure after the stream has started cannot change the
 * HTTP status any more, so it is sent as a final {@code error} event carrying the structured error.
 */
@Component
public class RunEventStreams {

    public static final String ERROR_EVENT = "error";

    private final ErrorTranslator translator;

    public RunEventStreams(ErrorTranslator translator) {
        this.translator = translator;
    }

    public <E> Flux<ServerSentEvent<Object>> toSse(StreamingRun<E> run, Function<E, String> eventName) {
        return run.events()
                .map(event -> ServerSentEvent.builder((Object) event)
                        .id(run.resourceId())
                        .event(eventName.apply(event))
                        .build())
                .onErrorResume(e -> Flux.just(ServerSentEvent.builder((Object) translator.translate(e))
                        .id(run.resourceId())
                        .event(ERROR_EVENT)
                        .build()));
    }
}
