package com.genji.queue.infra.messaging.consumer;

import com.genji.queue.common.exception.QueueDeclarationException;
import com.genji.queue.common.support.QueueNames;
import com.genji.queue.infra.messaging.rabbit.PooledChannel;
import com.genji.queue.infra.messaging.rabbit.QueueDeclarer;
import com.genji.queue.infra.messaging.rabbit.RabbitChannelPool;
import com.genji.queue.infra.messaging.rabbit.RabbitQueueProperties;
import com.genji.queue.infra.metrics.MetricsConfig;
import com.genji.queue.usecase.consumer.QueueHandlerRegistry;
import com.genji.queue.usecase.consumer.WrappedQueueHandler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 등록된 모든 큐를 소비한다.
 * <p>
 * 기동은 두 단계다.
 * <ol>
 *     <li>모든 큐/DLQ 를 선언하고 큐별 ready 수를 drain gate 에 더한 뒤 봉인한다</li>
 *     <li>큐마다 리스너 컨테이너를 띄운다</li>
 * </ol>
 * 선언이나 채널 획득 실패는 기동 실패로 전파된다. stop 뒤 다시 start 하면 새 gate 로 처음부터 센다.
 */
@Slf4j
@Component
public class QueueConsumerEngine implements SmartLifecycle {

    private final QueueHandlerRegistry registry;
    private final RabbitChannelPool channelPool;
    private final QueueDeclarer declarer;
    private final QueueListenerContainerFactory containerFactory;
    private final RabbitQueueProperties properties;
    private final MeterRegistry meterRegistry;

    private volatile StartupDrainGate drainGate = new StartupDrainGate();
    private final Map<String, MessageListenerContainer> containers = new LinkedHashMap<>();

    private volatile List<String> queueNames = List.of();
    private volatile boolean running;

    public QueueConsumerEngine(QueueHandlerRegistry registry,
                               RabbitChannelPool channelPool,
                               QueueDeclarer declarer,
                               QueueListenerContainerFactory containerFactory,
                               RabbitQueueProperties properties,
                               MeterRegistry meterRegistry) {
        this.registry = registry;
        this.channelPool = channelPool;
        this.declarer = declarer;
        this.containerFactory = containerFactory;
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        Gauge.builder(MetricsConfig.METRIC_STARTUP_PENDING, this, QueueConsumerEngine::pendingStartupMessages)
                .register(meterRegistry);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }

        Map<String, WrappedQueueHandler> handlers = registry.resolveAll();
        if (handlers.isEmpty()) {
            log.warn("[QueueEngine] no queue handlers registered");
        }

        // 재기동이면 현재 backlog 로 다시 센다
        StartupDrainGate gate = new StartupDrainGate();
        drainGate = gate;
        declareAll(handlers.keySet(), gate);
        gate.seal();

        handlers.forEach((queueName, handler) -> startConsumer(queueName, handler, gate));
        queueNames = List.copyOf(handlers.keySet());
        running = true;
        log.info("[QueueEngine] consuming {} queue(s): {}", queueNames.size(), queueNames);
    }

    @Override
    public synchronized void stop() {
        containers.forEach((queueName, container) -> {
            try {
                container.stop();
            } catch (RuntimeException e) {
                log.warn("[QueueEngine] failed to stop consumer. queue={}", queueName, e);
            }
        });
        containers.clear();
        running = false;
        log.info("[QueueEngine] consumers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 기동 backlog 가 모두 ack 될 때까지 막는다. drain-timeout 을 넘기면 경고만 남기고 돌아온다.
     */
    public void waitUntilDrained() {
        Duration timeout = properties.getDrainTimeout();
        try {
            if (!drainGate.await(timeout)) {
                log.warn("[QueueEngine] startup drain not finished after {}; {} message(s) still pending",
                        timeout, drainGate.pending());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[QueueEngine] interrupted while waiting for startup drain");
        }
    }

    public boolean waitUntilDrained(Duration timeout) throws InterruptedException {
        return drainGate.await(timeout);
    }

    public boolean isDraining() {
        return drainGate.isDraining();
    }

    public long pendingStartupMessages() {
        return drainGate.pending();
    }

    public List<String> queueNames() {
        return queueNames;
    }

    public List<String> listTargetDlqs() {
        return queueNames.stream().map(QueueNames::deadLetterQueue).toList();
    }

    private void declareAll(Iterable<String> names, StartupDrainGate gate) {
        try (PooledChannel pooled = channelPool.acquireChannel()) {
            for (String queueName : names) {
                try {
                    long ready = declarer.declareWithDeadLetter(pooled.channel(), queueName);
                    gate.addPending(ready);
                } catch (IOException | RuntimeException e) {
                    throw new QueueDeclarationException(queueName, e);
                }
            }
        }
    }

    private void startConsumer(String queueName, WrappedQueueHandler handler, StartupDrainGate gate) {
        AcknowledgingMessageListener listener =
                new AcknowledgingMessageListener(queueName, handler, gate, meterRegistry);
        MessageListenerContainer container = containerFactory.create(queueName, listener);
        containers.put(queueName, container);
        container.start();
        log.debug("[QueueEngine] consumer started. queue={}", queueName);
    }
}
