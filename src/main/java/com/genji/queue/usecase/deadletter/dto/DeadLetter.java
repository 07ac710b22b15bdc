package com.genji.queue.usecase.deadletter.dto;

import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * DLQ 에서 꺼낸 메시지. 다시 넣을 때 보존해야 하는 속성만 담는다.
 */
public record DeadLetter(
        long deliveryTag,
        byte[] body,
        Map<String, Object> headers,
        String contentType,
        String contentEncoding,
        Integer deliveryMode,
        String correlationId,
        String messageId,
        Date timestamp,
        String type,
        String appId,
        String userId
) {

    public DeadLetter {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(headers));
    }

    /**
     * 기존 헤더에 extra 를 덮어쓴 사본
     */
    public DeadLetter withHeaders(Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>(headers);
        merged.putAll(extra);
        return new DeadLetter(deliveryTag, body, merged, contentType, contentEncoding, deliveryMode,
                correlationId, messageId, timestamp, type, appId, userId);
    }
}
