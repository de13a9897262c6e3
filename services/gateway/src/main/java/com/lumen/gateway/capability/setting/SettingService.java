package com.lumen.gateway.capability.setting;

public interface SettingService {

    SecuritySetting readSecuritySetting();

    void updateSecuritySetting(SecuritySettingInput input);

    NetworkSetting readNetworkSetting();

    void updateNetworkSetting(NetworkSettingInput input);
}
