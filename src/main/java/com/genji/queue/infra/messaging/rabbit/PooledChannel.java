package com.genji.queue.infra.messaging.rabbit;

import com.rabbitmq.client.Channel;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.RabbitUtils;

/**
 * 풀에서 빌린 채널. close() 하면 채널이 풀로 돌아간다.
 * 브로커가 닫아버린 채널은 풀에 남지 않고 폐기된다.
 */
public final class PooledChannel implements AutoCloseable {

    private final Connection connection;
    private final Channel channel;

    public PooledChannel(Connection connection, Channel channel) {
        this.connection = connection;
        this.channel = channel;
    }

    public Channel channel() {
        return channel;
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        RabbitUtils.closeChannel(channel);
        // 공유 연결이라 실제로 끊기지 않는다
        RabbitUtils.closeConnection(connection);
    }
}
