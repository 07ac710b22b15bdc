package com.genji.queue.usecase.consumer;

import org.springframework.amqp.core.Message;

/**
 * 디코딩/멱등성/job 상태 보고가 씌워진 핸들러. ack/nack 은 호출하는 쪽(consumer engine) 책임이다.
 */
@FunctionalInterface
public interface WrappedQueueHandler {

    HandlingOutcome handle(Message message) throws Exception;
}
