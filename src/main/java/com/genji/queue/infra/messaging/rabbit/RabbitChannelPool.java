package com.genji.queue.infra.messaging.rabbit;

import com.genji.queue.common.exception.ChannelAcquisitionException;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.ChannelCallback;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * 선언/발행/DLQ sweep 용 연결·채널 풀.
 * <p>
 * 채널 수 상한과 대기 시간은 publisher 측 CachingConnectionFactory 설정을 따른다.
 * 상한에 걸려 대기 시간을 넘기면 {@link ChannelAcquisitionException}.
 */
@Slf4j
@Component
public class RabbitChannelPool {

    private final ConnectionFactory publisherConnectionFactory;

    public RabbitChannelPool(CachingConnectionFactory rabbitConnectionFactory) {
        ConnectionFactory publisher = rabbitConnectionFactory.getPublisherConnectionFactory();
        this.publisherConnectionFactory = publisher != null ? publisher : rabbitConnectionFactory;
    }

    /**
     * 연결은 브로커 재접속 시 새로 만들어진다. 호출자는 close() 로 돌려준다.
     */
    public Connection acquireConnection() {
        try {
            return publisherConnectionFactory.createConnection();
        } catch (AmqpException e) {
            throw new ChannelAcquisitionException("failed to acquire rabbit connection", e);
        }
    }

    public PooledChannel acquireChannel() {
        Connection connection = acquireConnection();
        try {
            Channel channel = connection.createChannel(false);
            return new PooledChannel(connection, channel);
        } catch (AmqpException e) {
            log.warn("[RabbitPool] channel checkout failed: {}", e.getMessage());
            throw new ChannelAcquisitionException("failed to acquire rabbit channel", e);
        }
    }

    /**
     * 채널을 빌려 콜백을 실행하고 반드시 돌려준다. 콜백 예외는 Spring AMQP 예외로 변환된다.
     */
    public <T> T withChannel(ChannelCallback<T> callback) {
        try (PooledChannel pooled = acquireChannel()) {
            return callback.doInRabbit(pooled.channel());
        } catch (ChannelAcquisitionException e) {
            throw e;
        } catch (Exception e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }
}
