package com.genji.queue.infra.messaging.consumer;

import com.genji.queue.common.exception.PayloadDecodeException;
import com.genji.queue.infra.metrics.MetricsConfig;
import com.genji.queue.usecase.consumer.HandlingOutcome;
import com.genji.queue.usecase.consumer.WrappedQueueHandler;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;

/**
 * 큐 하나를 맡는 manual-ack 리스너.
 * <p>
 * 핸들러가 정상 반환하면 ack, 예외면 requeue 없이 reject 해서 브로커가 Q.dlq 로 보낸다.
 * 리스너 밖으로는 예외를 던지지 않는다.
 */
@Slf4j
public class AcknowledgingMessageListener implements ChannelAwareMessageListener {

    private final String queueName;
    private final WrappedQueueHandler handler;
    private final StartupDrainGate drainGate;
    private final MeterRegistry meterRegistry;

    public AcknowledgingMessageListener(String queueName, WrappedQueueHandler handler,
                                        StartupDrainGate drainGate, MeterRegistry meterRegistry) {
        this.queueName = queueName;
        this.handler = handler;
        this.drainGate = drainGate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onMessage(Message message, Channel channel) {
        MessageProperties props = message.getMessageProperties();
        long deliveryTag = props.getDeliveryTag();

        HandlingOutcome outcome;
        try {
            outcome = handler.handle(message);
        } catch (PayloadDecodeException e) {
            String cause = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
            log.warn("[QueueConsumer] undecodable message from {}; rejecting to DLQ. messageId={}, correlationId={}, cause={}",
                    queueName, props.getMessageId(), props.getCorrelationId(), cause);
            reject(channel, deliveryTag);
            counter(MetricsConfig.RESULT_REJECT, MetricsConfig.REASON_INVALID_PAYLOAD).increment();
            return;
        } catch (Exception e) {
            log.error("[QueueConsumer] error processing message from {}; rejecting to DLQ. messageId={}, correlationId={}",
                    queueName, props.getMessageId(), props.getCorrelationId(), e);
            reject(channel, deliveryTag);
            counter(MetricsConfig.RESULT_REJECT, MetricsConfig.REASON_HANDLER_FAILURE).increment();
            return;
        }

        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException e) {
            // 채널이 끊겼으면 브로커가 재전달한다
            log.error("[QueueConsumer] ack failed. queue={}, deliveryTag={}", queueName, deliveryTag, e);
            counter(MetricsConfig.RESULT_ERROR, MetricsConfig.REASON_NONE).increment();
            return;
        }

        drainGate.onAcknowledged();
        counter(resultOf(outcome), MetricsConfig.REASON_NONE).increment();
    }

    private void reject(Channel channel, long deliveryTag) {
        try {
            channel.basicNack(deliveryTag, false, false);
        } catch (IOException e) {
            log.error("[QueueConsumer] reject failed. queue={}, deliveryTag={}", queueName, deliveryTag, e);
        }
    }

    private static String resultOf(HandlingOutcome outcome) {
        return switch (outcome) {
            case PROCESSED -> MetricsConfig.RESULT_SUCCESS;
            case BYPASSED -> MetricsConfig.RESULT_BYPASSED;
            case DUPLICATE -> MetricsConfig.RESULT_DUPLICATE;
        };
    }

    private Counter counter(String result, String reason) {
        return Counter.builder(MetricsConfig.METRIC_CONSUME)
                .tag(MetricsConfig.TAG_QUEUE, queueName)
                .tag(MetricsConfig.TAG_RESULT, result)
                .tag(MetricsConfig.TAG_REASON, reason)
                .register(meterRegistry);
    }
}
