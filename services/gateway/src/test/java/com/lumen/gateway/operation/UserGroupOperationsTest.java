package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.usergroup.UpsertMembershipInput;
import com.lumen.gateway.capability.usergroup.UserGroupInput;
import com.lumen.gateway.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("UserGroupOperations")
class UserGroupOperationsTest {

    private final TestServices services = new TestServices();
    private final UserGroupOperations operations = new UserGroupOperations(InputValidator.withDefaultProvider());

    @BeforeEach
    void setUp() {
        services.user("lead", false);
        services.user("bob", false);
        services.user("root", true);
        when(services.userGroup.isGroupAdmin("eng", "lead")).thenReturn(true);
    }

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Test
    @DisplayName("group admins add plain members")
    void groupAdminAddsMember() {
        var input = new UpsertMembershipInput("eng", "bob", false);

        assertThat(operations.upsertUserGroupMembership(services.as("lead"), input)).isTrue();
        verify(services.userGroup).upsertMembership(input);
    }

    @Test
    @DisplayName("group admins cannot appoint group admins")
    void groupAdminCannotAppoint() {
        assertThatThrownBy(() -> operations.upsertUserGroupMembership(services.as("lead"),
                new UpsertMembershipInput("eng", "bob", true)))
                .hasMessage("You must be admin to add a group admin");
        verify(services.userGroup, never()).upsertMembership(any());
    }

    @Test
    @DisplayName("group admins cannot remove themselves")
    void groupAdminCannotLeave() {
        assertThatThrownBy(() -> operations.deleteUserGroupMembership(services.as("lead"), "eng", "lead"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    @DisplayName("other members cannot manage the group")
    void membersRejected() {
        assertThatThrownBy(() -> operations.deleteUserGroupMembership(services.as("bob"), "eng", "lead"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    @DisplayName("group names are validated")
    void groupName() {
        assertThatThrownBy(() -> operations.createUserGroup(services.asAdmin("root"), new UserGroupInput("eng/ops")))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT));
        when(services.userGroup.create("eng ops")).thenReturn("g1");

        assertThat(operations.createUserGroup(services.asAdmin("root"), new UserGroupInput("eng ops"))).isEqualTo("g1");
    }

    @Test
    @DisplayName("source access policies are admin-only")
    void accessPoliciesAdminOnly() {
        assertThatThrownBy(() -> operations.grantSourceIdReadAccess(services.as("lead"), "src", "eng"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));

        operations.grantSourceIdReadAccess(services.asAdmin("root"), "src", "eng");

        verify(services.accessPolicy).grantSourceIdReadAccess("src", "eng");
    }
}
