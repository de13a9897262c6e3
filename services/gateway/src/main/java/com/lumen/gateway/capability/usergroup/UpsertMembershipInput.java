package com.lumen.gateway.capability.usergroup;

import jakarta.validation.constraints.NotBlank;

public record UpsertMembershipInput(@NotBlank String userGroupId, @NotBlank String userId, boolean groupAdmin) {
}
