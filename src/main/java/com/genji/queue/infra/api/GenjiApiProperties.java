package com.genji.queue.infra.api;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "genji.api")
public class GenjiApiProperties {

    private String baseUrl = "http://localhost:8000";

    /**
     * 모든 요청에 X-API-KEY 로 실린다
     */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(10);

    private Health health = new Health();

    @Getter @Setter
    public static class Health {
        private boolean enabled = true;
        private String path = "/healthcheck";
        private Duration interval = Duration.ofSeconds(30);
        // Retry-After 헤더 값이 이보다 크면 잘라낸다
        private Duration maxRetryAfter = Duration.ofMinutes(5);
    }
}
