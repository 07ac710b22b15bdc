package com.genji.queue.usecase.job;

import com.genji.queue.common.exception.ApiUnavailableException;
import com.genji.queue.common.exception.PayloadDecodeException;
import com.genji.queue.common.support.BestEffortResult;
import com.genji.queue.testsupport.stub.StubJobStatusClient;
import com.genji.queue.usecase.job.dto.JobState;
import com.genji.queue.usecase.job.dto.JobUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusReporterTest {

    private final StubJobStatusClient client = new StubJobStatusClient();
    private final JobStatusReporter reporter = new JobStatusReporter(client);

    @Test
    @DisplayName("코드를 가진 예외는 그 코드로 failed 를 보고한다")
    void 코드를_가진_예외는_그_코드로_보고한다() {
        UUID jobId = UUID.randomUUID();

        reporter.failed(jobId, new PayloadDecodeException("q", String.class, new RuntimeException("x")));

        JobUpdate update = client.updatesOf(jobId).get(0);
        assertThat(update.status()).isEqualTo(JobState.FAILED);
        assertThat(update.errorCode()).isEqualTo("DECODE_ERROR");
    }

    @Test
    @DisplayName("오류 메시지는 300자로 잘린다")
    void 오류_메시지는_300자로_잘린다() {
        UUID jobId = UUID.randomUUID();

        reporter.failed(jobId, new IllegalStateException("e".repeat(1000)));

        JobUpdate update = client.updatesOf(jobId).get(0);
        assertThat(update.errorCode()).isEqualTo("BOT_ERROR");
        assertThat(update.errorMsg()).hasSize(300);
    }

    @Test
    @DisplayName("메시지 없는 예외는 예외 클래스 이름을 메시지로 쓴다")
    void 메시지_없는_예외는_클래스_이름() {
        assertThat(JobStatusReporter.errorMessage(new NullPointerException())).isEqualTo("NullPointerException");
        assertThat(JobStatusReporter.errorCode(new ApiUnavailableException("down"))).isEqualTo("API_UNAVAILABLE");
    }

    @Test
    @DisplayName("보고 실패는 예외 대신 실패 결과로 돌아온다")
    void 보고_실패는_결과로_돌아온다() {
        client.failUpdates(true);

        BestEffortResult result = reporter.processing(UUID.randomUUID());

        assertThat(result.isOk()).isFalse();
        assertThat(result.error()).hasMessageContaining("TEST_UPDATE_FAIL");
    }
}
