package com.genji.queue.usecase.alert.port;

/**
 * 운영 채널로 텍스트 알림을 보낸다. 실패는 예외로 알린다.
 */
public interface ChatAlertSender {

    void send(String channelId, String content);
}
