package com.lumen.gateway.capability.setting;

import java.util.List;

public record SecuritySetting(
        List<String> allowedRegisterDomainList,
        boolean disableClientSideTelemetry,
        boolean disablePasswordLogin) {

    public SecuritySetting {
        allowedRegisterDomainList = allowedRegisterDomainList == null ? List.of() : List.copyOf(allowedRegisterDomainList);
    }
}
