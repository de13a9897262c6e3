package com.lumen.gateway.capability.repository;

import java.util.List;

public record GrepFile(String path, List<GrepLine> lines) {

    public record GrepLine(int lineNumber, String line) {
    }
}
