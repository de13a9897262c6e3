package com.lumen.gateway.capability.job;

public record JobStats(int success, int failed, int pending) {
}
