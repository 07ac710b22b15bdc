package com.genji.queue.usecase.job.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "genji.jobs.poll")
public class JobPollProperties {

    // 100ms 부터 두 배씩, 최대 5초 간격
    private Duration initialInterval = Duration.ofMillis(100);
    private Duration maxInterval = Duration.ofSeconds(5);

    // 전체 대기 예산
    private Duration maxDuration = Duration.ofSeconds(20);
}
