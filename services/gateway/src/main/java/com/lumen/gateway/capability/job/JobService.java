package com.lumen.gateway.capability.job;

import com.lumen.pagination.FetchWindow;

import java.util.List;

public interface JobService {

    /**
     * @param ids  null or empty for all runs
     * @param jobs null or empty for runs of every job
     */
    List<JobRun> list(List<String> ids, List<String> jobs, FetchWindow window);

    JobStats stats(List<String> jobs);

    /** @return id of the queued run */
    String trigger(String job);

    /** Names of the jobs that can be triggered. */
    List<String> jobNames();
}
