package com.lumen.gateway.api;

import com.lumen.gateway.capability.job.JobRun;
import com.lumen.gateway.capability.job.JobStats;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.JobOperations;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.pagination.Connection;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final JobOperations operations;

    public JobController(JobOperations operations) {
        this.operations = operations;
    }

    @GetMapping
    public List<String> jobs(RequestContext ctx) {
        return operations.jobs(ctx);
    }

    @GetMapping("/runs")
    public Connection<JobRun> jobRuns(
            RequestContext ctx,
            @RequestParam(required = false) List<String> ids,
            @RequestParam(required = false) List<String> jobs,
            PageArguments page) {
        return operations.jobRuns(ctx, ids, jobs, page);
    }

    @GetMapping("/stats")
    public JobStats jobRunStats(RequestContext ctx, @RequestParam(required = false) List<String> jobs) {
        return operations.jobRunStats(ctx, jobs);
    }

    @PostMapping("/{job}/runs")
    public String triggerJobRun(RequestContext ctx, @PathVariable String job) {
        return operations.triggerJobRun(ctx, job);
    }
}
