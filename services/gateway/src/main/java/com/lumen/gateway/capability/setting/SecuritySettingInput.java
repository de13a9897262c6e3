package com.lumen.gateway.capability.setting;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record SecuritySettingInput(
        @NotNull List<@Pattern(regexp = "^[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)+$", message = "must be a domain name") String>
                allowedRegisterDomainList,
        boolean disableClientSideTelemetry,
        boolean disablePasswordLogin) {
}
