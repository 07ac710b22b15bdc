package com.genji.queue.usecase.job.port;

import com.genji.queue.usecase.job.dto.JobStatus;
import com.genji.queue.usecase.job.dto.JobUpdate;

import java.util.Optional;
import java.util.UUID;

public interface JobStatusClient {

    Optional<JobStatus> getJob(UUID jobId);

    void updateJob(UUID jobId, JobUpdate update);
}
