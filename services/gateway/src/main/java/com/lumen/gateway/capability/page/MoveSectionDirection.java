package com.lumen.gateway.capability.page;

public enum MoveSectionDirection {
    UP,
    DOWN
}
