package com.genji.queue.usecase.completion;

import com.genji.queue.usecase.alert.port.ChatAlertSender;
import com.genji.queue.usecase.completion.dto.FailedAutoverifyMessage;
import com.genji.queue.usecase.consumer.QueueConsumerContributor;
import com.genji.queue.usecase.consumer.QueueHandlerRegistry;
import com.genji.queue.usecase.consumer.QueueRegistration;
import com.genji.queue.usecase.deadletter.config.DeadLetterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.stereotype.Component;

/**
 * 자동 검증에 실패한 기록 제출을 운영 채널로 넘긴다.
 * 전송 실패는 예외로 올라가 메시지가 DLQ 로 간다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoverificationFailedForwarder implements QueueConsumerContributor {

    public static final String QUEUE = "api.completion.autoverification.failed";

    private final ChatAlertSender alertSender;
    private final DeadLetterProperties deadLetterProperties;

    @Override
    public void registerQueueHandlers(QueueHandlerRegistry registry) {
        registry.register(QueueRegistration.builder(QUEUE, FailedAutoverifyMessage.class)
                .owner(this)
                .handler(this::forward));
    }

    void forward(FailedAutoverifyMessage payload, Message message) {
        log.debug("[Completion] forwarding failed autoverification. userId={}", payload.userId());
        alertSender.send(deadLetterProperties.getAlertChannelId(), render(payload));
    }

    static String render(FailedAutoverifyMessage payload) {
        String extracted = payload.extracted() == null ? "" : payload.extracted().toPrettyString();
        return "`Submitted Code` " + payload.submittedCode() + "\n"
                + "`Submitted Time` " + payload.submittedTime() + "\n"
                + "`User ID` " + payload.userId() + "\n"
                + "`Extracted Data`\n```\n" + extracted + "\n```";
    }
}
