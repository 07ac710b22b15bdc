package com.genji.queue.usecase.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genji.queue.common.exception.PayloadDecodeException;
import com.genji.queue.common.support.BestEffort;
import com.genji.queue.common.support.HeaderUtils;
import com.genji.queue.usecase.consumer.port.IdempotencyClaimClient;
import com.genji.queue.usecase.job.JobStatusReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.UUID;

/**
 * 등록된 비즈니스 핸들러 앞뒤로 공통 처리를 씌운다.
 * <ol>
 *     <li>테스트 우회 헤더가 참이면 아무것도 하지 않고 끝낸다</li>
 *     <li>body를 등록 타입으로 디코딩 (실패는 재시도 없이 DLQ)</li>
 *     <li>idempotent 면 message_id claim, 이미 claim 돼 있으면 중복으로 보고 끝낸다</li>
 *     <li>job 상태 보고(processing → succeeded/failed)</li>
 *     <li>핸들러 예외 시 claim 삭제 후 원래 예외를 다시 던진다</li>
 * </ol>
 */
@Slf4j
public class QueueHandlerWrapper<T> implements WrappedQueueHandler {

    private final QueueRegistration<T> registration;
    private final ObjectMapper objectMapper;
    private final IdempotencyClaimClient claimClient;
    private final JobStatusReporter jobStatusReporter;
    private final String testHeader;

    public QueueHandlerWrapper(
            QueueRegistration<T> registration,
            ObjectMapper objectMapper,
            IdempotencyClaimClient claimClient,
            JobStatusReporter jobStatusReporter,
            String testHeader
    ) {
        this.registration = registration;
        this.objectMapper = objectMapper;
        this.claimClient = claimClient;
        this.jobStatusReporter = jobStatusReporter;
        this.testHeader = testHeader;
    }

    @Override
    public HandlingOutcome handle(Message message) throws Exception {
        String queueName = registration.queueName();
        MessageProperties props = message.getMessageProperties();

        if (HeaderUtils.isTruthy(props.getHeaders(), testHeader)) {
            log.debug("[QueueHandler] test message received; skipping processing for {}.", queueName);
            return HandlingOutcome.BYPASSED;
        }

        T payload = decode(message.getBody());

        String messageId = props.getMessageId();
        boolean claimed = false;
        if (registration.idempotent() && StringUtils.hasText(messageId)) {
            if (!claimClient.claim(messageId).claimed()) {
                log.debug("[Idempotency] duplicate message ignored: {} ({})", messageId, queueName);
                return HandlingOutcome.DUPLICATE;
            }
            claimed = true;
        }

        UUID jobId = registration.reportsJobStatus() ? parseJobId(props.getCorrelationId()) : null;
        if (jobId != null) {
            jobStatusReporter.processing(jobId);
        }

        try {
            registration.callback().handle(payload, message);
        } catch (Exception e) {
            if (jobId != null) {
                jobStatusReporter.failed(jobId, e);
            }
            if (claimed) {
                BestEffort.run(
                        "[Idempotency] delete claim " + messageId + " (" + queueName + ")",
                        () -> claimClient.deleteClaim(messageId)
                );
            }
            throw e;
        }

        if (jobId != null) {
            jobStatusReporter.succeeded(jobId);
        }
        return HandlingOutcome.PROCESSED;
    }

    private T decode(byte[] body) {
        T payload;
        try {
            payload = objectMapper.readValue(body, registration.payloadType());
        } catch (IOException e) {
            throw new PayloadDecodeException(registration.queueName(), registration.payloadType(), e);
        }
        if (payload == null) {
            throw new PayloadDecodeException(
                    registration.queueName(),
                    registration.payloadType(),
                    new IllegalArgumentException("empty payload")
            );
        }
        return payload;
    }

    private UUID parseJobId(String correlationId) {
        if (!StringUtils.hasText(correlationId)) {
            return null;
        }
        try {
            return UUID.fromString(correlationId.trim());
        } catch (IllegalArgumentException e) {
            log.debug("[Jobs] correlation_id is not a job id; skip status report. correlationId={}", correlationId);
            return null;
        }
    }
}
