package com.genji.queue.infra.messaging.deadletter;

import com.genji.queue.infra.messaging.consumer.QueueConsumerEngine;
import com.genji.queue.infra.metrics.MetricsConfig;
import com.genji.queue.usecase.deadletter.DeadLetterSweeper;
import com.genji.queue.usecase.deadletter.config.DeadLetterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "genji.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterSweepScheduler implements SchedulingConfigurer {

    private final DeadLetterSweeper sweeper;
    private final QueueConsumerEngine engine;
    private final DeadLetterProperties properties;
    private final TaskScheduler queueTaskScheduler;
    private final Counter sweptCounter;
    private final Counter failedSweepCounter;

    public DeadLetterSweepScheduler(
            DeadLetterSweeper sweeper,
            QueueConsumerEngine engine,
            DeadLetterProperties properties,
            @Qualifier("queueTaskScheduler") TaskScheduler queueTaskScheduler,
            MeterRegistry meterRegistry
    ) {
        this.sweeper = sweeper;
        this.engine = engine;
        this.properties = properties;
        this.queueTaskScheduler = queueTaskScheduler;
        this.sweptCounter = Counter.builder(MetricsConfig.METRIC_DLQ_SWEEP_PROCESSED).register(meterRegistry);
        this.failedSweepCounter = Counter.builder(MetricsConfig.METRIC_DLQ_SWEEP)
                .tag(MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_ERROR)
                .register(meterRegistry);
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(queueTaskScheduler);
        Duration interval = properties.getProcessInterval();
        // 첫 실행은 한 주기 뒤
        taskRegistrar.addFixedDelayTask(new FixedDelayTask(this::tick, interval, interval));
    }

    void tick() {
        if (!engine.isRunning()) {
            return;
        }
        try {
            int processed = sweeper.sweepOnce(engine.queueNames());
            if (processed > 0) {
                log.info("[DLQ] processed {} message(s) across all DLQs", processed);
                sweptCounter.increment(processed);
            }
        } catch (RuntimeException e) {
            failedSweepCounter.increment();
            log.error("[DLQ] unhandled error during DLQ processing loop", e);
        }
    }
}
