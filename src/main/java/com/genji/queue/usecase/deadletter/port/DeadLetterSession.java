package com.genji.queue.usecase.deadletter.port;

import com.genji.queue.usecase.deadletter.dto.DeadLetter;

import java.util.Optional;

/**
 * 채널 하나 위에서 DLQ 를 조회/수거/재적재한다.
 */
public interface DeadLetterSession extends AutoCloseable {

    long depth(String dlqName);

    /**
     * auto-ack 없이 하나 꺼낸다. 비어 있으면 empty.
     */
    Optional<DeadLetter> pull(String dlqName);

    /**
     * 같은 DLQ 의 맨 뒤에 persistent 로 다시 넣는다.
     */
    void republish(String dlqName, DeadLetter letter);

    void ack(DeadLetter letter);

    boolean isOpen();

    @Override
    void close();
}
