package com.genji.queue.usecase.consumer;

public enum HandlingOutcome {
    /** 비즈니스 핸들러까지 정상 실행 */
    PROCESSED,
    /** 테스트 우회 헤더로 건너뜀 */
    BYPASSED,
    /** 이미 claim 된 message_id */
    DUPLICATE
}
