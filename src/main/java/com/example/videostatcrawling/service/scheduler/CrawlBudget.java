package com.example.videostatcrawling.service.scheduler;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행 1회 전체의 대상 계정 처리 한도
 * 
 * 모든 크롤러 계정 스레드가 공유합니다. 한도에 도달하면 새 세션은 시작하지 않지만
 * 이미 진행 중인 세션은 끝까지 진행됩니다.
 */
public class CrawlBudget {

    private final AtomicInteger remaining;

    public CrawlBudget(int limit) {
        this.remaining = new AtomicInteger(Math.max(0, limit));
    }

    /**
     * @return 한도가 남아 있어 1개를 차감했으면 true
     */
    public boolean tryAcquire() {
        while (true) {
            int current = remaining.get();
            if (current <= 0) {
                return false;
            }
            if (remaining.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    /** 차감했지만 세션을 시작하지 않은 경우 되돌림 */
    public void release() {
        remaining.incrementAndGet();
    }

    public int remaining() {
        return remaining.get();
    }
}
