package com.genji.queue.infra.messaging.rabbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genji.queue.infra.metrics.MetricsConfig;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.MessageProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * default exchange 로 큐 이름에 직접 persistent 발행한다.
 * 실패는 로그를 남기고 호출자에게 그대로 던진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueuePublisher {

    private final RabbitChannelPool channelPool;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public void publish(String queueName, byte[] body) {
        publish(queueName, body, MessageProperties.PERSISTENT_BASIC);
    }

    public void publish(String queueName, byte[] body, AMQP.BasicProperties properties) {
        try {
            channelPool.withChannel(channel -> {
                channel.basicPublish("", queueName, properties, body);
                return null;
            });
            counter(queueName, MetricsConfig.RESULT_SUCCESS).increment();
        } catch (RuntimeException e) {
            counter(queueName, MetricsConfig.RESULT_ERROR).increment();
            log.error("[QueuePublisher] publish failed. queue={}, bytes={}", queueName, body.length, e);
            throw e;
        }
    }

    /**
     * payload 를 JSON 으로 직렬화해 발행한다. messageId/correlationId/headers 는 null 이면 생략.
     */
    public void publishJson(String queueName, Object payload, String messageId, String correlationId,
                            Map<String, Object> headers) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable. queue=" + queueName, e);
        }
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .contentEncoding(StandardCharsets.UTF_8.name())
                .deliveryMode(2)
                .messageId(messageId)
                .correlationId(correlationId)
                .headers(headers)
                .build();
        publish(queueName, body, properties);
    }

    private Counter counter(String queueName, String result) {
        return Counter.builder(MetricsConfig.METRIC_PUBLISH)
                .tag(MetricsConfig.TAG_QUEUE, queueName)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }
}
