package com.genji.queue.usecase.deadletter.config;

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
@ConfigurationProperties(prefix = "genji.dlq")
public class DeadLetterProperties {

    /**
     * false 면 sweep 스케줄을 등록하지 않는다
     */
    private boolean enabled = true;

    /**
     * 알림을 이미 보냈다는 표시 헤더. 값이 정확히 true 일 때만 인정한다.
     */
    @NotBlank
    private String headerKey = "dlq_notified";

    @NotBlank
    private String notifiedAtKey = "dlq_notified_at";

    @NotNull
    private Duration processInterval = Duration.ofSeconds(60);

    /**
     * sweep 한 번에 DLQ 하나에서 꺼낼 최대 개수
     */
    @Min(1)
    private int maxPerQueueTick = 5000;

    /**
     * 운영 알림 채널 (Discord channel id)
     */
    private String alertChannelId;

    /**
     * 알림 본문에 넣을 payload 최대 길이
     */
    @Min(1)
    private int alertBodyLimit = 1800;

    /**
     * 알림이 끝난 메시지를 이 시간이 지나면 버린다. null 이면 버리지 않는다.
     */
    private Duration purgeNotifiedAfter;
}
