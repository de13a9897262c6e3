package com.lumen.gateway.capability.setting;

public record NetworkSetting(String externalUrl) {
}
