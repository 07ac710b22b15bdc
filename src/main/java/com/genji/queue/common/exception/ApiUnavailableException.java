package com.genji.queue.common.exception;

/**
 * Genji API가 헬스체크 기준으로 내려가 있거나 연결 자체가 실패한 경우.
 */
public class ApiUnavailableException extends RuntimeException implements ErrorCoded {

    public ApiUnavailableException(String message) {
        super(message);
    }

    public ApiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "API_UNAVAILABLE";
    }
}
