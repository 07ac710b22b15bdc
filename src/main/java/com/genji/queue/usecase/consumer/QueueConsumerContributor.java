package com.genji.queue.usecase.consumer;

/**
 * 큐 핸들러를 가진 서비스가 구현한다. 기동 시 registry 에 자신의 핸들러를 직접 등록한다.
 */
public interface QueueConsumerContributor {

    void registerQueueHandlers(QueueHandlerRegistry registry);
}
