package com.genji.queue.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    // 소비/DLQ/기동 backlog 지표
    public static final String METRIC_CONSUME = "genji.queue.consume";
    public static final String METRIC_PUBLISH = "genji.queue.publish";
    public static final String METRIC_STARTUP_PENDING = "genji.queue.startup.pending";
    public static final String METRIC_DLQ_SWEEP = "genji.dlq.sweep";
    public static final String METRIC_DLQ_SWEEP_PROCESSED = "genji.dlq.sweep.processed";
    public static final String METRIC_API_AVAILABLE = "genji.api.available";

    // 고카디널리티 금지(message_id/correlation_id 제외)
    public static final String TAG_QUEUE = "queue";
    public static final String TAG_RESULT = "result";
    public static final String TAG_REASON = "reason";

    // 고정 결과값
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_BYPASSED = "bypassed";
    public static final String RESULT_DUPLICATE = "duplicate";
    public static final String RESULT_REJECT = "reject";
    public static final String RESULT_ERROR = "error";

    // 사유 택소노미
    public static final String REASON_INVALID_PAYLOAD = "invalid_payload";
    public static final String REASON_HANDLER_FAILURE = "handler_failure";
    public static final String REASON_NONE = "none";
}
