package com.genji.queue.common.support;

/**
 * 부수효과 한 건의 결과. 실패해도 호출자에게 예외로 전파하지 않는다.
 */
public record BestEffortResult(String action, Throwable error) {

    public static BestEffortResult ok(String action) {
        return new BestEffortResult(action, null);
    }

    public static BestEffortResult failed(String action, Throwable error) {
        return new BestEffortResult(action, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
