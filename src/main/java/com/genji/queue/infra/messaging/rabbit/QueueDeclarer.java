package com.genji.queue.infra.messaging.rabbit;

import com.genji.queue.common.support.QueueNames;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 큐 Q 와 Q.dlq 를 durable 로 선언하고 Q 의 reject 가 default exchange 를 통해 Q.dlq 로 가도록 묶는다.
 * 이미 다른 인자로 선언된 큐는 브로커가 PRECONDITION_FAILED 로 거부한다.
 */
@Slf4j
@Component
public class QueueDeclarer {

    public static final String ARG_DLX = "x-dead-letter-exchange";
    public static final String ARG_DLX_ROUTING_KEY = "x-dead-letter-routing-key";

    /**
     * @return 선언 직후 Q 에 쌓여있는 메시지 수
     */
    public long declareWithDeadLetter(Channel channel, String queueName) throws IOException {
        String dlqName = QueueNames.deadLetterQueue(queueName);

        channel.queueDeclare(dlqName, true, false, false, null);
        channel.queueDeclare(queueName, true, false, false, Map.of(
                ARG_DLX, "",
                ARG_DLX_ROUTING_KEY, dlqName
        ));

        long ready = channel.queueDeclarePassive(queueName).getMessageCount();
        log.info("[QueueDeclarer] declared queue={} dlq={} ready={}", queueName, dlqName, ready);
        return ready;
    }
}
