package com.example.videostatcrawling.service.navigation;

/**
 * 허용된 화면 전환 목록 (이 외의 전환은 시도하지 않음)
 */
public enum Transition {

    /** URL 직접 이동 (어느 화면에서든 가능) */
    ENTER_PUBLISHER_PAGE(Screen.ANY_PAGE, Screen.PUBLISHER_PAGE),

    /** 가장 최근 동영상 썸네일 클릭 */
    OPEN_NEWEST_VIDEO(Screen.PUBLISHER_PAGE, Screen.VIDEO_PAGE),

    /** "크리에이터 동영상" 버튼 클릭 */
    OPEN_CREATOR_FEED(Screen.VIDEO_PAGE, Screen.VIDEO_PAGE_WITH_CREATOR_FEED),

    /** 닫기 버튼 클릭 */
    CLOSE_VIDEO(Screen.VIDEO_PAGE, Screen.PUBLISHER_PAGE),

    /** 닫기 버튼 클릭 */
    CLOSE_CREATOR_FEED(Screen.VIDEO_PAGE_WITH_CREATOR_FEED, Screen.PUBLISHER_PAGE);

    private final Screen from;
    private final Screen to;

    Transition(Screen from, Screen to) {
        this.from = from;
        this.to = to;
    }

    public Screen getTo() {
        return to;
    }

    /**
     * from 이 ANY_PAGE 인 전환은 현재 화면과 상관없이 허용
     */
    public boolean isLegalFrom(Screen current) {
        return from == Screen.ANY_PAGE || from == current;
    }
}
