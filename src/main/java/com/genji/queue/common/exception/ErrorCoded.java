package com.genji.queue.common.exception;

/**
 * job 실패 보고 시 error_code 로 쓰이는 값을 노출하는 예외.
 */
public interface ErrorCoded {

    String getErrorCode();
}
