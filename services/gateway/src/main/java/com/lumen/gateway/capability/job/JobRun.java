package com.lumen.gateway.capability.job;

import com.lumen.pagination.Node;

import java.time.Instant;

/**
 * One execution of a background job.
 *
 * @param exitCode null while the run is in progress
 */
public record JobRun(
        String id,
        String job,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Integer exitCode,
        String stdout,
        String stderr) implements Node {
}
