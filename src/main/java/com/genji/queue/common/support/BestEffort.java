package com.genji.queue.common.support;

import lombok.extern.slf4j.Slf4j;

/**
 * claim 삭제, job 상태 보고, 알림 전송처럼 메시지 흐름을 막으면 안 되는 부수효과용.
 * <p>
 * 실패는 WARN 로그만 남기고 버린다. 그 결과 외부 상태(job/claim)가 잠시 어긋날 수 있다.
 */
@Slf4j
public final class BestEffort {

    private BestEffort() {}

    public static BestEffortResult run(String action, Runnable task) {
        try {
            task.run();
            return BestEffortResult.ok(action);
        } catch (Exception e) {
            log.warn("[BestEffort] {} failed: {}", action, e.toString());
            return BestEffortResult.failed(action, e);
        }
    }
}
