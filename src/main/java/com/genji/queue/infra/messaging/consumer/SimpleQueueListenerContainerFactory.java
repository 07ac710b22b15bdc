package com.genji.queue.infra.messaging.consumer;

import com.genji.queue.infra.messaging.rabbit.RabbitQueueProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.stereotype.Component;

/**
 * 큐당 consumer 1개, prefetch 1, manual ack.
 * 같은 큐의 메시지는 한 번에 하나씩 처리되고 큐끼리는 병렬로 돈다.
 */
@Component
@RequiredArgsConstructor
public class SimpleQueueListenerContainerFactory implements QueueListenerContainerFactory {

    private static final int PREFETCH = 1;

    private final CachingConnectionFactory rabbitConnectionFactory;
    private final RabbitQueueProperties properties;

    @Override
    public MessageListenerContainer create(String queueName, ChannelAwareMessageListener listener) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(rabbitConnectionFactory);
        container.setQueueNames(queueName);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(PREFETCH);
        container.setConcurrentConsumers(1);
        container.setMaxConcurrentConsumers(1);
        container.setDefaultRequeueRejected(false);
        container.setRecoveryInterval(properties.getRecoveryIntervalMs());
        container.setMissingQueuesFatal(true);
        container.setMessageListener(listener);
        container.setBeanName("queue-consumer-" + queueName);
        container.afterPropertiesSet();
        return container;
    }
}
