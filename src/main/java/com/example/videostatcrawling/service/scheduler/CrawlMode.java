package com.example.videostatcrawling.service.scheduler;

/**
 * 수집할 레코드 종류
 */
public enum CrawlMode {
    /** 게시자 목록 + 크리에이터 피드 병합 레코드만 */
    LIGHT,
    /** 최신 동영상 상세 레코드만 */
    HEAVY,
    /** 둘 다 */
    BOTH;

    public boolean includesLight() {
        return this != HEAVY;
    }

    public boolean includesHeavy() {
        return this != LIGHT;
    }
}
