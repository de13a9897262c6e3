package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.gateway.capability.job.JobRun;
import com.lumen.gateway.capability.job.JobStats;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class JobOperations {

    public Connection<JobRun> jobRuns(RequestContext ctx, List<String> ids, List<String> jobs, PageArguments page) {
        Guards.admin(ctx);
        return ConnectionBuilder.query(page.window(), window -> ctx.services().job().list(ids, jobs, window));
    }

    public JobStats jobRunStats(RequestContext ctx, List<String> jobs) {
        Guards.admin(ctx);
        return ctx.services().job().stats(jobs);
    }

    /** @return id of the queued run */
    public String triggerJobRun(RequestContext ctx, String job) {
        Guards.admin(ctx);
        if (job == null || !ctx.services().job().jobNames().contains(job)) {
            throw CoreException.invalidInput("command", "unknown job");
        }
        return ctx.services().job().trigger(job);
    }

    public List<String> jobs(RequestContext ctx) {
        Guards.admin(ctx);
        return ctx.services().job().jobNames();
    }
}
