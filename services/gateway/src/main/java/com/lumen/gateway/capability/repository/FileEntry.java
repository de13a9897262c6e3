package com.lumen.gateway.capability.repository;

import java.util.List;

/**
 * @param kind    "file" or "dir"
 * @param path    path relative to the repository root
 * @param indices matched character positions in {@code path}
 */
public record FileEntry(String kind, String path, List<Integer> indices) {
}
