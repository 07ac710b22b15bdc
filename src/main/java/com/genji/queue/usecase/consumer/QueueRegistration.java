package com.genji.queue.usecase.consumer;

import java.util.Objects;

/**
 * 큐 하나에 대한 핸들러 등록 정보. 기동 시 한 번 만들어지고 이후 바뀌지 않는다.
 *
 * @param queueName        소비할 큐 이름 (DLQ는 {@code queueName + ".dlq"})
 * @param payloadType      body를 디코딩할 타입
 * @param idempotent       true면 message_id 로 claim 후 실행
 * @param reportsJobStatus true면 correlation_id 를 job id로 보고 상태를 보고
 * @param owner            등록한 서비스 (로그용)
 * @param callback         비즈니스 핸들러
 */
public record QueueRegistration<T>(
        String queueName,
        Class<T> payloadType,
        boolean idempotent,
        boolean reportsJobStatus,
        Object owner,
        QueueHandler<T> callback
) {

    public QueueRegistration {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(callback, "callback");
        if (queueName.isBlank()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
    }

    public static <T> Builder<T> builder(String queueName, Class<T> payloadType) {
        return new Builder<>(queueName, payloadType);
    }

    public String ownerName() {
        return owner == null ? "unknown" : owner.getClass().getSimpleName();
    }

    public static final class Builder<T> {
        private final String queueName;
        private final Class<T> payloadType;
        private boolean idempotent;
        private boolean reportsJobStatus;
        private Object owner;

        private Builder(String queueName, Class<T> payloadType) {
            this.queueName = queueName;
            this.payloadType = payloadType;
        }

        public Builder<T> idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder<T> reportsJobStatus(boolean reportsJobStatus) {
            this.reportsJobStatus = reportsJobStatus;
            return this;
        }

        public Builder<T> owner(Object owner) {
            this.owner = owner;
            return this;
        }

        public QueueRegistration<T> handler(QueueHandler<T> callback) {
            return new QueueRegistration<>(queueName, payloadType, idempotent, reportsJobStatus, owner, callback);
        }
    }
}
