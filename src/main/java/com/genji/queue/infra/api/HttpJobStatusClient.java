package com.genji.queue.infra.api;

import com.genji.queue.common.exception.ApiHttpException;
import com.genji.queue.usecase.job.dto.JobStatus;
import com.genji.queue.usecase.job.dto.JobUpdate;
import com.genji.queue.usecase.job.port.JobStatusClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class HttpJobStatusClient implements JobStatusClient {

    static final String JOB_PATH = "/internal/jobs/{jobId}";

    private final GenjiApiClient apiClient;

    @Override
    public Optional<JobStatus> getJob(UUID jobId) {
        try {
            return Optional.ofNullable(
                    apiClient.exchange(HttpMethod.GET, JOB_PATH, null, JobStatus.class, jobId).getBody());
        } catch (ApiHttpException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void updateJob(UUID jobId, JobUpdate update) {
        apiClient.exchange(HttpMethod.PATCH, JOB_PATH, update, Void.class, jobId);
    }
}
