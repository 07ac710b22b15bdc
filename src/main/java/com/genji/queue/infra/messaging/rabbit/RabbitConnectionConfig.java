package com.genji.queue.infra.messaging.rabbit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * 브로커 연결 설정.
 * <p>
 * 연결은 consumer 용 1개 + publisher 용 1개로 고정하고,
 * 선언/발행/DLQ sweep 이 쓰는 publisher 측 채널 캐시는 checkout timeout 을 걸어 크기가 상한인 풀로 쓴다.
 * consumer 측은 큐마다 채널을 오래 잡고 있으므로 상한을 걸지 않는다.
 */
@Slf4j
@Configuration
public class RabbitConnectionConfig {

    @Bean
    public CachingConnectionFactory rabbitConnectionFactory(RabbitProperties rabbitProperties,
                                                            RabbitQueueProperties queueProperties) {
        CachingConnectionFactory factory = new CachingConnectionFactory(
                rabbitProperties.determineHost(),
                rabbitProperties.determinePort()
        );
        // 인증/vhost 는 publisher 쪽 팩토리와 공유된다
        factory.setUsername(rabbitProperties.determineUsername());
        factory.setPassword(rabbitProperties.determinePassword());
        if (StringUtils.hasText(rabbitProperties.determineVirtualHost())) {
            factory.setVirtualHost(rabbitProperties.determineVirtualHost());
        }
        factory.setConnectionNameStrategy(cf -> "genji-queue");

        CachingConnectionFactory publisher = (CachingConnectionFactory) factory.getPublisherConnectionFactory();
        if (publisher != null) {
            publisher.setConnectionNameStrategy(cf -> "genji-queue-publisher");
            publisher.setChannelCacheSize(queueProperties.getPool().getChannelSize());
            publisher.setChannelCheckoutTimeout(queueProperties.getPool().getChannelCheckoutTimeout().toMillis());
        }

        log.info("[RabbitPool] broker={}:{} channelPool={} checkoutTimeout={}",
                rabbitProperties.determineHost(), rabbitProperties.determinePort(),
                queueProperties.getPool().getChannelSize(),
                queueProperties.getPool().getChannelCheckoutTimeout());
        return factory;
    }
}
