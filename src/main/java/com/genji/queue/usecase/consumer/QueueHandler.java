package com.genji.queue.usecase.consumer;

import org.springframework.amqp.core.Message;

/**
 * 이벤트 하나를 처리하는 비즈니스 핸들러.
 * 디코딩된 payload와 원본 메시지를 함께 받는다. 예외를 던지면 해당 메시지는 DLQ로 간다.
 */
@FunctionalInterface
public interface QueueHandler<T> {

    void handle(T payload, Message message) throws Exception;
}
