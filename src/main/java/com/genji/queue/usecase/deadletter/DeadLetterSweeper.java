package com.genji.queue.usecase.deadletter;

import com.genji.queue.common.support.BestEffort;
import com.genji.queue.common.support.BestEffortResult;
import com.genji.queue.common.support.HeaderUtils;
import com.genji.queue.common.support.QueueNames;
import com.genji.queue.usecase.alert.port.ChatAlertSender;
import com.genji.queue.usecase.deadletter.config.DeadLetterProperties;
import com.genji.queue.usecase.deadletter.dto.DeadLetter;
import com.genji.queue.usecase.deadletter.port.DeadLetterQueueGateway;
import com.genji.queue.usecase.deadletter.port.DeadLetterSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * DLQ 를 한 바퀴 훑어 아직 알리지 않은 메시지를 운영 채널로 알린다.
 * <p>
 * 큐마다 sweep 시작 시점의 깊이 D 를 먼저 재고 min(D, maxPerQueueTick) 개까지만 꺼낸다.
 * 다시 넣은 메시지가 같은 sweep 에서 또 잡히지 않게 하기 위한 상한이다.
 * 알린 메시지는 알림 표시 헤더를 달아 DLQ 맨 뒤로 돌려놓는다. 메시지를 버리지는 않는다
 * (purgeNotifiedAfter 가 설정된 경우 제외).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterSweeper {

    private final DeadLetterQueueGateway gateway;
    private final ChatAlertSender alertSender;
    private final DeadLetterProperties properties;
    private final Clock clock;

    /**
     * @param baseQueues 등록된 원본 큐 이름들. 각 큐의 Q.dlq 를 훑는다
     * @return 이번 sweep 에서 처리한 메시지 수
     */
    public int sweepOnce(Collection<String> baseQueues) {
        int total = 0;
        try (DeadLetterSession session = gateway.openSession()) {
            for (String baseQueue : baseQueues) {
                if (!session.isOpen()) {
                    log.warn("[DLQ] channel closed during sweep; remaining queues wait for the next cycle");
                    break;
                }
                try {
                    total += sweepQueue(session, baseQueue);
                } catch (RuntimeException e) {
                    log.error("[DLQ] error processing DLQ for base queue '{}'", baseQueue, e);
                }
            }
        }
        return total;
    }

    int sweepQueue(DeadLetterSession session, String baseQueue) {
        String dlqName = QueueNames.deadLetterQueue(baseQueue);

        long depth = session.depth(dlqName);
        long cap = Math.min(depth, properties.getMaxPerQueueTick());
        if (cap <= 0) {
            return 0;
        }

        int processed = 0;
        int alerted = 0;
        while (processed < cap) {
            Optional<DeadLetter> next = session.pull(dlqName);
            if (next.isEmpty()) {
                break;
            }
            DeadLetter letter = next.get();

            if (HeaderUtils.isExactlyTrue(letter.headers(), properties.getHeaderKey())) {
                putBackNotified(session, dlqName, letter);
            } else if (alertAndPutBack(session, dlqName, letter)) {
                alerted++;
            }
            processed++;
        }

        if (processed > 0) {
            log.debug("[DLQ] {} processed={} alerted={} cap={} depth={}", dlqName, processed, alerted, cap, depth);
        }
        return processed;
    }

    private void putBackNotified(DeadLetterSession session, String dlqName, DeadLetter letter) {
        if (isExpired(letter)) {
            session.ack(letter);
            log.info("[DLQ] purged notified message from {}. messageId={}", dlqName, letter.messageId());
            return;
        }
        session.republish(dlqName, letter);
        session.ack(letter);
    }

    /**
     * 알림 실패 시 표시 헤더 없이 돌려놓아 다음 sweep 에서 다시 알린다.
     */
    private boolean alertAndPutBack(DeadLetterSession session, String dlqName, DeadLetter letter) {
        String content = DeadLetterAlertFormatter.format(dlqName, letter.body(), properties.getAlertBodyLimit());
        BestEffortResult alert = BestEffort.run(
                "[DLQ] alert for " + dlqName,
                () -> alertSender.send(properties.getAlertChannelId(), content)
        );

        DeadLetter copy = alert.isOk()
                ? letter.withHeaders(Map.of(
                        properties.getHeaderKey(), true,
                        properties.getNotifiedAtKey(), clock.instant().getEpochSecond()))
                : letter;

        session.republish(dlqName, copy);
        session.ack(letter);
        return alert.isOk();
    }

    private boolean isExpired(DeadLetter letter) {
        Duration purgeAfter = properties.getPurgeNotifiedAfter();
        if (purgeAfter == null) {
            return false;
        }
        Long notifiedAt = HeaderUtils.getLong(letter.headers(), properties.getNotifiedAtKey());
        if (notifiedAt == null) {
            return false;
        }
        return clock.instant().getEpochSecond() - notifiedAt >= purgeAfter.toSeconds();
    }
}
