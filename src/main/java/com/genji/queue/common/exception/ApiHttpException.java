package com.genji.queue.common.exception;

public class ApiHttpException extends RuntimeException implements ErrorCoded {

    private final int status;

    public ApiHttpException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public String getErrorCode() {
        return "HTTP_" + status;
    }
}
