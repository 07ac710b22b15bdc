package com.genji.queue.common.exception;

public class ChannelAcquisitionException extends RuntimeException {

    public ChannelAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
