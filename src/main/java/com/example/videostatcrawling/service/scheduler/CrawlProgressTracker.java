package com.example.videostatcrawling.service.scheduler;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 크롤링 진행 상황을 실시간으로 추적하는 싱글톤 컴포넌트.
 * 여러 크롤러 계정 스레드에서 안전하게 접근할 수 있습니다.
 */
@Component
public class CrawlProgressTracker {

    // 멀티스레드 환경에서 원자적으로 숫자를 증가시키기 위해 AtomicLong 사용
    private final AtomicLong inFlight = new AtomicLong(0);
    private final AtomicLong completed = new AtomicLong(0);
    private final AtomicLong aborted = new AtomicLong(0);

    public void sessionStarted() {
        inFlight.incrementAndGet();
    }

    public void sessionFinished(boolean done) {
        inFlight.decrementAndGet();
        (done ? completed : aborted).incrementAndGet();
    }

    public long getInFlightCount() {
        return inFlight.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getAbortedCount() {
        return aborted.get();
    }
}
