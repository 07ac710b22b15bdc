package com.genji.queue.testsupport.stub;

import com.genji.queue.usecase.deadletter.dto.DeadLetter;
import com.genji.queue.usecase.deadletter.port.DeadLetterQueueGateway;
import com.genji.queue.usecase.deadletter.port.DeadLetterSession;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 브로커 없이 DLQ 동작을 흉내낸다. 꺼낸 메시지는 ack 전까지 unacked 로 남고,
 * 다시 넣은 메시지는 큐 맨 뒤에 붙는다.
 */
public class InMemoryDeadLetterGateway implements DeadLetterQueueGateway {

    private final Map<String, Deque<DeadLetter>> queues = new HashMap<>();
    private final Map<Long, DeadLetter> unacked = new HashMap<>();
    private final Set<String> failingQueues = new HashSet<>();
    private final AtomicLong deliveryTags = new AtomicLong(0);
    private final AtomicInteger pullCount = new AtomicInteger(0);
    private final AtomicInteger sessionCount = new AtomicInteger(0);
    private int closeAfterPulls = -1;

    public synchronized void put(String dlqName, String body) {
        put(dlqName, body, Map.of());
    }

    public synchronized void put(String dlqName, String body, Map<String, Object> headers) {
        queue(dlqName).addLast(new DeadLetter(0, body.getBytes(StandardCharsets.UTF_8), headers,
                "application/json", "utf-8", 2, "corr-" + body.hashCode(), "msg-" + body.hashCode(),
                null, null, null, null));
    }

    public synchronized List<DeadLetter> contents(String dlqName) {
        return new ArrayList<>(queue(dlqName));
    }

    public synchronized int unackedCount() {
        return unacked.size();
    }

    public void failOn(String dlqName) {
        failingQueues.add(dlqName);
    }

    /**
     * n 번 꺼낸 뒤 채널이 닫힌 것처럼 동작한다
     */
    public void closeAfterPulls(int n) {
        this.closeAfterPulls = n;
    }

    public int getPullCount() {
        return pullCount.get();
    }

    public int getSessionCount() {
        return sessionCount.get();
    }

    private Deque<DeadLetter> queue(String dlqName) {
        return queues.computeIfAbsent(dlqName, k -> new ArrayDeque<>());
    }

    @Override
    public DeadLetterSession openSession() {
        sessionCount.incrementAndGet();
        return new Session();
    }

    private class Session implements DeadLetterSession {

        private boolean open = true;

        @Override
        public long depth(String dlqName) {
            synchronized (InMemoryDeadLetterGateway.this) {
                if (failingQueues.contains(dlqName)) {
                    throw new IllegalStateException("TEST_QUEUE_FAIL " + dlqName);
                }
                return queue(dlqName).size();
            }
        }

        @Override
        public Optional<DeadLetter> pull(String dlqName) {
            synchronized (InMemoryDeadLetterGateway.this) {
                DeadLetter head = queue(dlqName).pollFirst();
                if (head == null) {
                    return Optional.empty();
                }
                if (pullCount.incrementAndGet() == closeAfterPulls) {
                    open = false;
                }
                long tag = deliveryTags.incrementAndGet();
                DeadLetter delivered = new DeadLetter(tag, head.body(), head.headers(), head.contentType(),
                        head.contentEncoding(), head.deliveryMode(), head.correlationId(), head.messageId(),
                        head.timestamp(), head.type(), head.appId(), head.userId());
                unacked.put(tag, delivered);
                return Optional.of(delivered);
            }
        }

        @Override
        public void republish(String dlqName, DeadLetter letter) {
            synchronized (InMemoryDeadLetterGateway.this) {
                queue(dlqName).addLast(letter);
            }
        }

        @Override
        public void ack(DeadLetter letter) {
            synchronized (InMemoryDeadLetterGateway.this) {
                unacked.remove(letter.deliveryTag());
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
