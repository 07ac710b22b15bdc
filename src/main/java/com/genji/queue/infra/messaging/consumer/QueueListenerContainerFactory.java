package com.genji.queue.infra.messaging.consumer;

import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

/**
 * 큐 하나에 붙는 리스너 컨테이너를 만든다. 반환된 컨테이너는 아직 시작되지 않은 상태다.
 */
@FunctionalInterface
public interface QueueListenerContainerFactory {

    MessageListenerContainer create(String queueName, ChannelAwareMessageListener listener);
}
