package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.thread.ChatThread;
import com.lumen.gateway.capability.thread.CreateMessageInput;
import com.lumen.gateway.capability.thread.CreateThreadInput;
import com.lumen.gateway.capability.thread.UpdateMessageInput;
import com.lumen.gateway.support.TestServices;
import com.lumen.pagination.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ThreadOperations")
class ThreadOperationsTest {

    private final TestServices services = new TestServices();
    private final ThreadOperations operations = new ThreadOperations(InputValidator.withDefaultProvider());

    @BeforeEach
    void users() {
        services.user("alice", false);
        services.user("bob", false);
        services.user("root", true);
    }

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Nested
    @DisplayName("deleteThread")
    class DeleteThread {

        @Test
        @DisplayName("non-owners are FORBIDDEN and the thread survives")
        void nonOwner() {
            String threadId = services.thread.seed("alice", false);

            assertThatThrownBy(() -> operations.deleteThread(services.as("bob"), threadId))
                    .hasMessage("You must be the thread owner to delete the thread")
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            assertThat(services.thread.get(threadId)).isPresent();
        }

        @Test
        @DisplayName("the owner deletes it and later reads are NOT_FOUND")
        void owner() {
            String threadId = services.thread.seed("alice", false);

            assertThat(operations.deleteThread(services.as("alice"), threadId)).isTrue();

            assertThatThrownBy(() -> operations.threadMessages(services.as("alice"), threadId, PageArguments.all()))
                    .hasMessage("Thread not found")
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.NOT_FOUND));
        }

        @Test
        @DisplayName("admins cannot delete other users' threads")
        void admin() {
            String threadId = services.thread.seed("alice", false);

            assertThatThrownBy(() -> operations.deleteThread(services.asAdmin("root"), threadId))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
        }

        @Test
        @DisplayName("a missing thread is NOT_FOUND, not FORBIDDEN")
        void missing() {
            assertThatThrownBy(() -> operations.deleteThread(services.as("bob"), "t404"))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.NOT_FOUND));
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("persisted threads of other users are readable")
        void persistedReadable() {
            String threadId = services.thread.seed("alice", false);

            assertThat(operations.threadMessages(services.as("bob"), threadId, PageArguments.all()).edges()).isEmpty();
        }

        @Test
        @DisplayName("ephemeral threads of other users are FORBIDDEN")
        void ephemeralPrivate() {
            String threadId = services.thread.seed("alice", true);

            assertThatThrownBy(() -> operations.threadMessages(services.as("bob"), threadId, PageArguments.all()))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
        }

        @Test
        @DisplayName("threads fails as a whole when any node is unreadable")
        void listFailsOnUnreadableNode() {
            services.thread.seed("alice", false);
            services.thread.seed("alice", true);

            assertThatThrownBy(() -> operations.threads(services.as("bob"), null, null, PageArguments.all()))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            assertThat(operations.threads(services.as("bob"), null, false, PageArguments.all()).edges()).hasSize(1);
        }

        @Test
        @DisplayName("myThreads lists only the caller's threads")
        void myThreads() {
            String mine = services.thread.seed("alice", true);
            services.thread.seed("bob", true);

            Connection<ChatThread> threads = operations.myThreads(services.as("alice"), PageArguments.all());

            assertThat(threads.nodes()).extracting(ChatThread::id).containsExactly(mine);
        }
    }

    @Nested
    @DisplayName("auth-token callers")
    class AuthToken {

        @Test
        @DisplayName("read their threads and messages")
        void read() {
            String threadId = services.thread.create("alice",
                    new CreateThreadInput(new CreateMessageInput("hi", List.of())));

            assertThat(operations.threadMessages(services.withAuthToken("alice"), threadId, PageArguments.all()).nodes())
                    .hasSize(1);
            assertThat(operations.myThreads(services.withAuthToken("alice"), PageArguments.all()).nodes())
                    .extracting(ChatThread::id)
                    .containsExactly(threadId);
            assertThat(operations.threads(services.withAuthToken("alice"), List.of(threadId), null, PageArguments.all())
                    .edges()).hasSize(1);
        }

        @Test
        @DisplayName("persist and delete their threads")
        void mutate() {
            String persisted = services.thread.seed("alice", true);
            String deleted = services.thread.seed("alice", true);

            assertThat(operations.setThreadPersisted(services.withAuthToken("alice"), persisted)).isTrue();
            assertThat(operations.deleteThread(services.withAuthToken("alice"), deleted)).isTrue();
            assertThat(services.thread.get(deleted)).isEmpty();
        }

        @Test
        @DisplayName("still need ownership")
        void ownership() {
            String threadId = services.thread.seed("alice", false);

            assertThatThrownBy(() -> operations.deleteThread(services.withAuthToken("bob"), threadId))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
        }

        @Test
        @DisplayName("cannot edit message content")
        void updateRejected() {
            String threadId = services.thread.seed("alice", false);

            assertThatThrownBy(() -> operations.updateThreadMessage(services.withAuthToken("alice"),
                    new UpdateMessageInput("m1", threadId, "edited")))
                    .hasMessage("Invoking this API with an auth token is not allowed");
        }
    }

    @Nested
    @DisplayName("mutations")
    class Mutations {

        @Test
        @DisplayName("only the owner persists a thread")
        void persist() {
            String threadId = services.thread.seed("alice", true);

            assertThatThrownBy(() -> operations.setThreadPersisted(services.as("bob"), threadId))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            assertThat(operations.setThreadPersisted(services.as("alice"), threadId)).isTrue();
            assertThat(services.thread.get(threadId)).hasValueSatisfying(t -> assertThat(t.ephemeral()).isFalse());
        }

        @Test
        @DisplayName("updateThreadMessage validates before looking up the thread")
        void updateValidates() {
            assertThatThrownBy(() -> operations.updateThreadMessage(services.as("alice"),
                    new UpdateMessageInput("m1", "t404", "")))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT));
        }

        @Test
        @DisplayName("message pairs are removed by the owner only")
        void deletePair() {
            String threadId = services.thread.create("alice",
                    new CreateThreadInput(
                            new CreateMessageInput("hi", List.of())));
            String messageId = services.thread.messagesOf(threadId).get(0).id();

            assertThatThrownBy(() -> operations.deleteThreadMessagePair(services.as("bob"), threadId, messageId, "a1"))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            operations.deleteThreadMessagePair(services.as("alice"), threadId, messageId, "a1");

            assertThat(services.thread.messagesOf(threadId)).isEmpty();
        }
    }
}
