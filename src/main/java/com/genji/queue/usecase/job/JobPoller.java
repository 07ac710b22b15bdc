package com.genji.queue.usecase.job;

import com.genji.queue.usecase.job.config.JobPollProperties;
import com.genji.queue.usecase.job.dto.JobStatus;
import com.genji.queue.usecase.job.port.JobStatusClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * job 이 끝날 때까지 점점 간격을 늘려가며 조회한다.
 * <p>
 * 대기는 스케줄러에 다음 조회를 예약하는 방식이라 스레드를 붙잡지 않는다.
 * 예산을 다 쓰면 마지막으로 본 상태(진행 중일 수 있음)를 돌려준다.
 */
@Slf4j
@Component
public class JobPoller {

    private final JobStatusClient jobStatusClient;
    private final TaskScheduler taskScheduler;
    private final JobPollProperties props;
    private final Clock clock;

    public JobPoller(
            JobStatusClient jobStatusClient,
            @Qualifier("queueTaskScheduler") TaskScheduler taskScheduler,
            JobPollProperties props,
            Clock clock
    ) {
        this.jobStatusClient = jobStatusClient;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.clock = clock;
    }

    public CompletableFuture<Optional<JobStatus>> pollUntilComplete(UUID jobId) {
        CompletableFuture<Optional<JobStatus>> result = new CompletableFuture<>();
        Instant deadline = clock.instant().plus(props.getMaxDuration());
        taskScheduler.schedule(() -> attempt(jobId, props.getInitialInterval(), deadline, result), clock.instant());
        return result;
    }

    private void attempt(UUID jobId, Duration interval, Instant deadline,
                         CompletableFuture<Optional<JobStatus>> result) {
        Optional<JobStatus> job;
        try {
            job = jobStatusClient.getJob(jobId);
        } catch (Exception e) {
            result.completeExceptionally(e);
            return;
        }

        if (job.isEmpty() || job.get().status() == null || !job.get().status().isInProgress()) {
            result.complete(job);
            return;
        }

        Instant now = clock.instant();
        if (!now.isBefore(deadline)) {
            log.debug("[Jobs] poll budget exhausted. jobId={}, lastStatus={}", jobId, job.get().status());
            result.complete(job);
            return;
        }

        Duration next = interval.multipliedBy(2);
        if (next.compareTo(props.getMaxInterval()) > 0) {
            next = props.getMaxInterval();
        }
        Duration nextInterval = next;
        Instant nextAt = now.plus(interval).isAfter(deadline) ? deadline : now.plus(interval);
        taskScheduler.schedule(() -> attempt(jobId, nextInterval, deadline, result), nextAt);
    }
}
