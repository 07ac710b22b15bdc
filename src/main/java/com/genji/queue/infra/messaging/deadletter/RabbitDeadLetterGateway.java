package com.genji.queue.infra.messaging.deadletter;

import com.genji.queue.infra.messaging.rabbit.RabbitChannelPool;
import com.genji.queue.usecase.deadletter.port.DeadLetterQueueGateway;
import com.genji.queue.usecase.deadletter.port.DeadLetterSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RabbitDeadLetterGateway implements DeadLetterQueueGateway {

    private final RabbitChannelPool channelPool;

    @Override
    public DeadLetterSession openSession() {
        return new RabbitDeadLetterSession(channelPool.acquireChannel());
    }
}
