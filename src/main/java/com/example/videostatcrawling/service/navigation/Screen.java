package com.example.videostatcrawling.service.navigation;

/**
 * 탐색 상태 머신이 구분하는 화면
 */
public enum Screen {

    /** 진입점 / 알 수 없는 화면 */
    ANY_PAGE(null),

    PUBLISHER_PAGE(PageLocators.PUBLISHER_READY),

    VIDEO_PAGE(PageLocators.VIDEO_READY),

    /** 동영상 페이지 + 크리에이터 동영상 목록 패널 */
    VIDEO_PAGE_WITH_CREATOR_FEED(PageLocators.CREATOR_FEED_READY);

    /** 이 화면임을 확인하는 요소 */
    private final String definingLocator;

    Screen(String definingLocator) {
        this.definingLocator = definingLocator;
    }

    /**
     * 화면 전환 완료로 보는 조건 (목적지 요소 또는 이상 화면 표식)
     * 이상 화면은 전환 후 AnomalyDetector 가 분류합니다.
     */
    public String readinessLocator() {
        if (definingLocator == null) {
            return PageLocators.ANOMALY_SIGNATURES;
        }
        return definingLocator + ", " + PageLocators.ANOMALY_SIGNATURES;
    }
}
