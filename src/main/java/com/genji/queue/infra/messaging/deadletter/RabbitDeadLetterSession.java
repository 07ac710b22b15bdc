package com.genji.queue.infra.messaging.deadletter;

import com.genji.queue.infra.messaging.rabbit.PooledChannel;
import com.genji.queue.usecase.deadletter.dto.DeadLetter;
import com.genji.queue.usecase.deadletter.port.DeadLetterSession;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;
import java.util.Optional;

/**
 * basicGet 기반 DLQ 세션. 채널은 close() 때 풀로 돌아간다.
 */
class RabbitDeadLetterSession implements DeadLetterSession {

    private final PooledChannel pooled;

    RabbitDeadLetterSession(PooledChannel pooled) {
        this.pooled = pooled;
    }

    @Override
    public long depth(String dlqName) {
        try {
            return channel().queueDeclarePassive(dlqName).getMessageCount();
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public Optional<DeadLetter> pull(String dlqName) {
        GetResponse response;
        try {
            response = channel().basicGet(dlqName, false);
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(toDeadLetter(response));
    }

    @Override
    public void republish(String dlqName, DeadLetter letter) {
        try {
            channel().basicPublish("", dlqName, toProperties(letter), letter.body());
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void ack(DeadLetter letter) {
        try {
            channel().basicAck(letter.deliveryTag(), false);
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public boolean isOpen() {
        return pooled.isOpen();
    }

    @Override
    public void close() {
        pooled.close();
    }

    private Channel channel() {
        return pooled.channel();
    }

    static DeadLetter toDeadLetter(GetResponse response) {
        AMQP.BasicProperties props = response.getProps();
        return new DeadLetter(
                response.getEnvelope().getDeliveryTag(),
                response.getBody(),
                props.getHeaders(),
                props.getContentType(),
                props.getContentEncoding(),
                props.getDeliveryMode(),
                props.getCorrelationId(),
                props.getMessageId(),
                props.getTimestamp(),
                props.getType(),
                props.getAppId(),
                props.getUserId()
        );
    }

    static AMQP.BasicProperties toProperties(DeadLetter letter) {
        // 원래 transient 였던 메시지도 DLQ 안에서는 persistent 로 둔다
        Integer deliveryMode = letter.deliveryMode() != null ? letter.deliveryMode() : 2;
        return new AMQP.BasicProperties.Builder()
                .headers(letter.headers())
                .contentType(letter.contentType())
                .contentEncoding(letter.contentEncoding())
                .deliveryMode(deliveryMode)
                .correlationId(letter.correlationId())
                .messageId(letter.messageId())
                .timestamp(letter.timestamp())
                .type(letter.type())
                .appId(letter.appId())
                .userId(letter.userId())
                .build();
    }
}
