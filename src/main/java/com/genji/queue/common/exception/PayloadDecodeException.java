package com.genji.queue.common.exception;

/**
 * 메시지 body를 등록된 타입으로 디코딩하지 못한 경우.
 * 재전달돼도 형식이 바뀌지 않으므로 재시도하지 않고 DLQ로 보낸다.
 */
public class PayloadDecodeException extends RuntimeException implements ErrorCoded {

    public PayloadDecodeException(String queueName, Class<?> payloadType, Throwable cause) {
        super("cannot decode payload. queue=" + queueName + ", type=" + payloadType.getSimpleName(), cause);
    }

    @Override
    public String getErrorCode() {
        return "DECODE_ERROR";
    }
}
