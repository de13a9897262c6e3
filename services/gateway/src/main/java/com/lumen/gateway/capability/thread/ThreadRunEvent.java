package com.lumen.gateway.capability.thread;

/**
 * Item emitted while a thread run progresses. {@link #type()} becomes the SSE event name.
 */
public interface ThreadRunEvent {

    String type();

    record ThreadCreated(String id) implements ThreadRunEvent {
        @Override
        public String type() {
            return "thread-created";
        }
    }

    record UserMessageCreated(String id) implements ThreadRunEvent {
        @Override
        public String type() {
            return "user-message-created";
        }
    }

    record AssistantMessageCreated(String id) implements ThreadRunEvent {
        @Override
        public String type() {
            return "assistant-message-created";
        }
    }

    record AssistantMessageContentDelta(String delta) implements ThreadRunEvent {
        @Override
        public String type() {
            return "assistant-message-content-delta";
        }
    }

    record AssistantMessageCompleted(String id) implements ThreadRunEvent {
        @Override
        public String type() {
            return "assistant-message-completed";
        }
    }
}
