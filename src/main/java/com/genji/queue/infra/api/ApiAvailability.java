package com.genji.queue.infra.api;

import com.genji.queue.common.exception.ApiUnavailableException;
import com.genji.queue.infra.metrics.MetricsConfig;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Genji API 가용 상태. 헬스체크와 실제 요청의 연결 실패가 함께 갱신한다.
 * 기동 직후에는 사용 가능으로 본다.
 */
@Slf4j
@Component
public class ApiAvailability {

    private final AtomicBoolean available = new AtomicBoolean(true);

    public ApiAvailability(MeterRegistry meterRegistry) {
        Gauge.builder(MetricsConfig.METRIC_API_AVAILABLE, available, a -> a.get() ? 1.0 : 0.0)
                .register(meterRegistry);
    }

    public boolean isAvailable() {
        return available.get();
    }

    public void ensureAvailable() {
        if (!available.get()) {
            throw new ApiUnavailableException("Genji API is currently unavailable");
        }
    }

    public void markAvailable() {
        if (available.compareAndSet(false, true)) {
            log.info("[GenjiApi] API is available again");
        }
    }

    public void markUnavailable(String reason) {
        if (available.compareAndSet(true, false)) {
            log.warn("[GenjiApi] API marked unavailable: {}", reason);
        }
    }
}
