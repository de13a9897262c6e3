package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.capability.auth.UserNameInput;
import com.lumen.gateway.support.TestServices;
import com.lumen.pagination.Connection;
import com.lumen.pagination.CursorCodec;
import com.lumen.pagination.FetchWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("UserAdminOperations")
class UserAdminOperationsTest {

    private final TestServices services = new TestServices();
    private final UserAdminOperations operations = new UserAdminOperations(InputValidator.withDefaultProvider());

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Nested
    @DisplayName("users")
    class Users {

        @Test
        @DisplayName("pages through users with cursors")
        void pagesThroughUsers() {
            services.user("alice", false);
            User u1 = services.user("u1", false);
            User u2 = services.user("u2", false);
            when(services.auth.listUsers(eq(null), any(FetchWindow.class))).thenReturn(List.of(u1, u2));

            Connection<User> page = operations.users(services.as("alice"), null, PageArguments.first(1));

            assertThat(page.nodes()).containsExactly(u1);
            assertThat(page.pageInfo().hasNextPage()).isTrue();
            assertThat(page.pageInfo().endCursor()).isEqualTo(CursorCodec.encode("u1"));
        }

        @Test
        @DisplayName("asks the backing store for one row past the page")
        void fetchesOneExtraRow() {
            services.user("alice", false);
            when(services.auth.listUsers(any(), any())).thenReturn(List.of());

            operations.users(services.as("alice"), List.of("u1"), new PageArguments(CursorCodec.encode("u0"), null, 10, null));

            verify(services.auth).listUsers(List.of("u1"), new FetchWindow("u0", null, 11, null));
        }

        @Test
        @DisplayName("anonymous callers are rejected before cursors are parsed")
        void guardBeforeCursor() {
            assertThatThrownBy(() -> operations.users(services.anonymous(), null,
                    new PageArguments("%%%", null, null, null)))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.UNAUTHORIZED));
        }

        @Test
        @DisplayName("malformed cursors are INVALID_INPUT")
        void malformedCursor() {
            services.user("alice", false);

            assertThatThrownBy(() -> operations.users(services.as("alice"), null,
                    new PageArguments("%%%", null, null, null)))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT));
            verify(services.auth, never()).listUsers(any(), any());
        }
    }

    @Nested
    @DisplayName("role and activation")
    class RoleAndActivation {

        @Test
        @DisplayName("members cannot change roles")
        void membersRejected() {
            services.user("bob", false);

            assertThatThrownBy(() -> operations.updateUserRole(services.as("bob"), "carol", true))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            verify(services.auth, never()).updateUserRole(anyString(), anyBoolean());
        }

        @Test
        @DisplayName("admins cannot change their own role")
        void selfRoleRejected() {
            services.user("root", true);

            assertThatThrownBy(() -> operations.updateUserRole(services.asAdmin("root"), "root", false))
                    .hasMessage("You cannot update your own role")
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
            verify(services.auth, never()).updateUserRole(anyString(), anyBoolean());
        }

        @Test
        @DisplayName("admins cannot deactivate themselves")
        void selfDeactivationRejected() {
            services.user("root", true);

            assertThatThrownBy(() -> operations.updateUserActive(services.asAdmin("root"), "root", false))
                    .hasMessage("You cannot change your own active status");
            verify(services.auth, never()).updateUserActive(anyString(), anyBoolean());
        }

        @Test
        @DisplayName("admins deactivate other users")
        void deactivatesOthers() {
            services.user("root", true);

            assertThat(operations.updateUserActive(services.asAdmin("root"), "bob", false)).isTrue();
            verify(services.auth).updateUserActive("bob", false);
        }
    }

    @Nested
    @DisplayName("profile")
    class Profile {

        @Test
        @DisplayName("another user's avatar is UNAUTHORIZED")
        void otherAvatar() {
            assertThatThrownBy(() -> operations.uploadUserAvatarBase64(services.as("bob"), "alice", "aGk="))
                    .hasMessage("You cannot change another user's avatar")
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.UNAUTHORIZED));
        }

        @Test
        @DisplayName("invalid base64 is INVALID_INPUT on avatarBase64")
        void invalidBase64() {
            assertThatThrownBy(() -> operations.uploadUserAvatarBase64(services.as("bob"), "bob", "not base64!"))
                    .satisfies(t -> {
                        assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT);
                        assertThat(((CoreException) t).violations()).extracting("path").containsExactly("avatarBase64");
                    });
        }

        @Test
        @DisplayName("decodes the avatar and a null payload clears it")
        void decodesAvatar() {
            operations.uploadUserAvatarBase64(services.as("bob"), "bob", "aGk=");
            operations.uploadUserAvatarBase64(services.as("bob"), "bob", null);

            verify(services.auth).updateUserAvatar("bob", "hi".getBytes());
            verify(services.auth).updateUserAvatar("bob", null);
        }

        @Test
        @DisplayName("blank names are rejected")
        void blankName() {
            assertThatThrownBy(() -> operations.updateUserName(services.as("bob"), "bob", new UserNameInput(" ")))
                    .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT));
        }
    }
}
