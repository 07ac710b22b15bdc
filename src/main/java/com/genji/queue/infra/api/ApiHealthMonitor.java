package com.genji.queue.infra.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 주기적으로 헬스체크를 호출해 {@link ApiAvailability} 를 갱신한다.
 * 실패 응답에 Retry-After 가 있으면 다음 확인을 그만큼 미룬다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "genji.api.health", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApiHealthMonitor implements SchedulingConfigurer {

    private final RestTemplate restTemplate;
    private final ApiAvailability availability;
    private final GenjiApiProperties props;
    private final TaskScheduler queueTaskScheduler;

    private final AtomicReference<Duration> nextDelay = new AtomicReference<>();

    public ApiHealthMonitor(
            @Qualifier("genjiApiRestTemplate") RestTemplate restTemplate,
            ApiAvailability availability,
            GenjiApiProperties props,
            @Qualifier("queueTaskScheduler") TaskScheduler queueTaskScheduler
    ) {
        this.restTemplate = restTemplate;
        this.availability = availability;
        this.props = props;
        this.queueTaskScheduler = queueTaskScheduler;
        this.nextDelay.set(props.getHealth().getInterval());
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(queueTaskScheduler);
        taskRegistrar.addTriggerTask(this::check, ctx -> {
            Instant last = ctx.lastCompletion();
            return last == null ? Instant.now() : last.plus(nextDelay.get());
        });
    }

    void check() {
        Duration interval = props.getHealth().getInterval();
        try {
            restTemplate.getForEntity(props.getHealth().getPath(), Void.class);
            availability.markAvailable();
            nextDelay.set(interval);
        } catch (HttpStatusCodeException e) {
            availability.markUnavailable("healthcheck returned " + e.getStatusCode().value());
            nextDelay.set(retryAfter(e.getResponseHeaders(), interval));
        } catch (RuntimeException e) {
            availability.markUnavailable(e.getMessage());
            nextDelay.set(interval);
        }
    }

    Duration nextDelay() {
        return nextDelay.get();
    }

    Duration retryAfter(HttpHeaders headers, Duration fallback) {
        if (headers == null) {
            return fallback;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return fallback;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            if (seconds <= 0) {
                return fallback;
            }
            Duration requested = Duration.ofSeconds(seconds);
            Duration max = props.getHealth().getMaxRetryAfter();
            return requested.compareTo(max) > 0 ? max : requested;
        } catch (NumberFormatException e) {
            log.debug("[GenjiApi] ignoring non-numeric Retry-After: {}", value);
            return fallback;
        }
    }
}
