package com.genji.queue.infra.messaging.consumer;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 기동 시점 backlog 추적.
 * <p>
 * 선언 단계에서 큐별 ready 수를 {@link #addPending(long)} 로 모두 더한 뒤 {@link #seal()} 한다.
 * 이후 성공 ack 마다 1씩 줄고, 0이 되면 한 번만 열린다. 열린 뒤의 ack 는 더 이상 세지 않는다.
 * reject(DLQ 행)는 세지 않으므로 backlog 중 실패가 있으면 대기 시간 상한으로만 풀린다.
 */
@Slf4j
public class StartupDrainGate {

    private final AtomicLong pending = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean(true);
    private final CountDownLatch drained = new CountDownLatch(1);
    private volatile boolean sealed;

    public void addPending(long count) {
        if (sealed) {
            throw new IllegalStateException("drain gate already sealed");
        }
        if (count > 0) {
            pending.addAndGet(count);
        }
    }

    public void seal() {
        sealed = true;
        long total = pending.get();
        if (total <= 0) {
            open("no startup messages to process");
        } else {
            log.info("[DrainGate] waiting for {} startup message(s) to be acknowledged", total);
        }
    }

    public void onAcknowledged() {
        if (!draining.get()) {
            return;
        }
        long left = pending.decrementAndGet();
        if (left <= 0 && sealed) {
            open("all startup messages processed");
        }
    }

    /**
     * @return 시간 안에 열렸으면 true
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isDraining() {
        return draining.get();
    }

    public long pending() {
        return Math.max(0, pending.get());
    }

    private void open(String reason) {
        if (draining.compareAndSet(true, false)) {
            log.info("[DrainGate] {}", reason);
            drained.countDown();
        }
    }
}
