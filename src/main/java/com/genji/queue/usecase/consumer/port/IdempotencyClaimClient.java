package com.genji.queue.usecase.consumer.port;

/**
 * message_id 단위 멱등성 claim. 실제 저장소는 Genji API 쪽에 있다.
 */
public interface IdempotencyClaimClient {

    /**
     * 같은 key에 대해 처음 호출한 쪽만 claimed=true 를 받는다 (삭제 전까지).
     */
    ClaimResult claim(String messageId);

    /**
     * 없는 claim 삭제는 오류가 아니다.
     */
    void deleteClaim(String messageId);

    record ClaimResult(boolean claimed) {
    }
}
