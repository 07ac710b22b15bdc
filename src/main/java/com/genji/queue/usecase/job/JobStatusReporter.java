package com.genji.queue.usecase.job;

import com.genji.queue.common.exception.ErrorCoded;
import com.genji.queue.common.support.BestEffort;
import com.genji.queue.common.support.BestEffortResult;
import com.genji.queue.usecase.job.dto.JobState;
import com.genji.queue.usecase.job.dto.JobUpdate;
import com.genji.queue.usecase.job.port.JobStatusClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * correlation_id(job id) 기준으로 processing/succeeded/failed 를 보고한다.
 * 보고 실패는 로그만 남기고 메시지 처리를 막지 않는다.
 */
@Component
@RequiredArgsConstructor
public class JobStatusReporter {

    static final String DEFAULT_ERROR_CODE = "BOT_ERROR";
    static final int MAX_ERROR_MSG_LENGTH = 300;

    private final JobStatusClient jobStatusClient;

    public BestEffortResult processing(UUID jobId) {
        return report(jobId, JobUpdate.of(JobState.PROCESSING));
    }

    public BestEffortResult succeeded(UUID jobId) {
        return report(jobId, JobUpdate.of(JobState.SUCCEEDED));
    }

    public BestEffortResult failed(UUID jobId, Throwable cause) {
        return report(jobId, JobUpdate.failed(errorCode(cause), errorMessage(cause)));
    }

    private BestEffortResult report(UUID jobId, JobUpdate update) {
        return BestEffort.run(
                "[Jobs] PATCH " + jobId + " -> " + update.status().value(),
                () -> jobStatusClient.updateJob(jobId, update)
        );
    }

    static String errorCode(Throwable cause) {
        if (cause instanceof ErrorCoded coded && coded.getErrorCode() != null) {
            return coded.getErrorCode();
        }
        return DEFAULT_ERROR_CODE;
    }

    static String errorMessage(Throwable cause) {
        String msg = cause.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = cause.getClass().getSimpleName();
        }
        return msg.length() > MAX_ERROR_MSG_LENGTH ? msg.substring(0, MAX_ERROR_MSG_LENGTH) : msg;
    }
}
