package com.genji.queue.infra.messaging.rabbit;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "genji.rabbit")
public class RabbitQueueProperties {

    /**
     * 이 헤더가 참인 메시지는 핸들러를 실행하지 않고 ack 한다 (운영 큐에서 통합 테스트용).
     */
    @NotBlank
    private String testHeader = "x-test-enabled";

    /**
     * waitUntilDrained() 내부 대기 상한. 넘기면 로그만 남기고 진행한다.
     */
    @NotNull
    private Duration drainTimeout = Duration.ofMinutes(10);

    /**
     * 리스너 컨테이너 복구 간격
     */
    private long recoveryIntervalMs = 3000;

    @Valid
    private Pool pool = new Pool();

    @Getter @Setter
    public static class Pool {
        // publisher 측 채널 풀 크기 (checkout timeout 과 함께 상한으로 동작)
        @Min(1)
        private int channelSize = 10;
        @NotNull
        private Duration channelCheckoutTimeout = Duration.ofSeconds(5);
    }
}
