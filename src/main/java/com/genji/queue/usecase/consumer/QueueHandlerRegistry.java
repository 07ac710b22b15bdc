package com.genji.queue.usecase.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genji.queue.usecase.consumer.port.IdempotencyClaimClient;
import com.genji.queue.usecase.job.JobStatusReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 큐 이름 → 핸들러 테이블. consumer engine 하나가 소유한다.
 * <p>
 * 큐 하나에는 핸들러 하나만 허용한다. 같은 큐를 두 번 등록하면 설정 오류로 로그를 남기고 먼저 등록된 쪽을 유지한다.
 * {@link #resolveAll()} 이후에는 더 이상 등록할 수 없다.
 */
@Slf4j
public class QueueHandlerRegistry {

    private final Map<String, QueueRegistration<?>> registrations = new LinkedHashMap<>();

    private final ObjectMapper objectMapper;
    private final IdempotencyClaimClient claimClient;
    private final JobStatusReporter jobStatusReporter;
    private final String testHeader;

    private Map<String, WrappedQueueHandler> resolved;

    public QueueHandlerRegistry(
            ObjectMapper objectMapper,
            IdempotencyClaimClient claimClient,
            JobStatusReporter jobStatusReporter,
            String testHeader
    ) {
        this.objectMapper = objectMapper;
        this.claimClient = claimClient;
        this.jobStatusReporter = jobStatusReporter;
        this.testHeader = testHeader;
    }

    public <T> boolean register(String queueName, Class<T> payloadType, boolean idempotent, QueueHandler<T> callback) {
        return register(QueueRegistration.builder(queueName, payloadType)
                .idempotent(idempotent)
                .handler(callback));
    }

    public synchronized boolean register(QueueRegistration<?> registration) {
        if (resolved != null) {
            throw new IllegalStateException(
                    "queue handlers already resolved; cannot register " + registration.queueName());
        }

        QueueRegistration<?> existing = registrations.get(registration.queueName());
        if (existing != null) {
            log.error("[QueueRegistry] duplicate handler for queue '{}': {} ignored, keeping {}",
                    registration.queueName(), registration.ownerName(), existing.ownerName());
            return false;
        }

        registrations.put(registration.queueName(), registration);
        log.debug("[QueueRegistry] registered handler for '{}' (owner={}, idempotent={}, jobStatus={})",
                registration.queueName(), registration.ownerName(),
                registration.idempotent(), registration.reportsJobStatus());
        return true;
    }

    /**
     * 등록된 모든 핸들러를 공통 처리로 감싸서 반환한다. 반환 순서는 등록 순서와 같다.
     */
    public synchronized Map<String, WrappedQueueHandler> resolveAll() {
        if (resolved == null) {
            Map<String, WrappedQueueHandler> wrapped = new LinkedHashMap<>();
            registrations.forEach((queueName, registration) -> wrapped.put(queueName, wrap(registration)));
            resolved = Collections.unmodifiableMap(wrapped);
        }
        return resolved;
    }

    public synchronized List<String> queueNames() {
        return List.copyOf(registrations.keySet());
    }

    private <T> WrappedQueueHandler wrap(QueueRegistration<T> registration) {
        return new QueueHandlerWrapper<>(registration, objectMapper, claimClient, jobStatusReporter, testHeader);
    }
}
