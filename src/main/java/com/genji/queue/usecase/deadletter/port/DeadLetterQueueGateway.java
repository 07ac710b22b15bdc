package com.genji.queue.usecase.deadletter.port;

public interface DeadLetterQueueGateway {

    /**
     * sweep 한 번 동안 쓸 채널을 연다. 획득 실패는 예외로 전파된다.
     */
    DeadLetterSession openSession();
}
