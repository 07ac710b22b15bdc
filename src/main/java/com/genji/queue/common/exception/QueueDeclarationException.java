package com.genji.queue.common.exception;

/**
 * 기동 시 큐/DLQ 선언 실패. 큐가 빠진 채로 동작하면 안 되므로 기동을 중단한다.
 */
public class QueueDeclarationException extends RuntimeException {

    public QueueDeclarationException(String queueName, Throwable cause) {
        super("failed to declare queue. queue=" + queueName, cause);
    }
}
