package com.genji.queue.infra.api;

import com.genji.queue.usecase.job.dto.JobState;
import com.genji.queue.usecase.job.dto.JobStatus;
import com.genji.queue.usecase.job.dto.JobUpdate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpJobStatusClientTest {

    private MockRestServiceServer server;
    private HttpJobStatusClient client;

    @BeforeEach
    void setUp() {
        GenjiApiProperties props = new GenjiApiProperties();
        props.setBaseUrl("http://genji.test");

        RestTemplate restTemplate = new GenjiApiConfig().genjiApiRestTemplate(new RestTemplateBuilder(), props);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpJobStatusClient(
                new GenjiApiClient(restTemplate, new ApiAvailability(new SimpleMeterRegistry()), props));
    }

    @Test
    @DisplayName("failed 갱신은 snake_case 오류 필드와 함께 PATCH 된다")
    void failed_갱신은_오류_필드와_PATCH() {
        UUID jobId = UUID.randomUUID();
        server.expect(requestTo("http://genji.test/internal/jobs/" + jobId))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(content().json("{\"status\":\"failed\",\"error_code\":\"BOT_ERROR\",\"error_msg\":\"boom\"}"))
                .andRespond(withSuccess());

        client.updateJob(jobId, JobUpdate.failed("BOT_ERROR", "boom"));

        server.verify();
    }

    @Test
    @DisplayName("processing 갱신에는 오류 필드가 실리지 않는다")
    void processing_갱신은_상태만_보낸다() {
        UUID jobId = UUID.randomUUID();
        server.expect(requestTo("http://genji.test/internal/jobs/" + jobId))
                .andExpect(content().json("{\"status\":\"processing\"}", true))
                .andRespond(withSuccess());

        client.updateJob(jobId, JobUpdate.of(JobState.PROCESSING));

        server.verify();
    }

    @Test
    @DisplayName("조회 결과를 JobStatus 로 돌려주고 404 는 empty 다")
    void 조회_결과와_404() {
        UUID jobId = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        server.expect(requestTo("http://genji.test/internal/jobs/" + jobId))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"id\":\"" + jobId + "\",\"status\":\"succeeded\",\"error_code\":null}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://genji.test/internal/jobs/" + missing))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        Optional<JobStatus> found = client.getJob(jobId);
        Optional<JobStatus> notFound = client.getJob(missing);

        assertThat(found).isPresent();
        assertThat(found.get().status()).isEqualTo(JobState.SUCCEEDED);
        assertThat(notFound).isEmpty();
    }
}
