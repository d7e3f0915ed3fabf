package com.example.videostatcrawling.service.navigation;

/**
 * 화면별 CSS 선택자 모음
 * 
 * 플랫폼 화면 구조가 바뀌면 이 파일만 수정합니다.
 */
public final class PageLocators {

    /** 인스턴스화 방지 */
    private PageLocators() {}

    // --- 게시자 페이지 ---
    public static final String PUBLISHER_READY = "[data-e2e='user-title']";
    public static final String PUBLISHER_ITEM = "[data-e2e='user-post-item']";
    /** 목록 첫 번째(가장 최근) 동영상 썸네일 링크 */
    public static final String NEWEST_VIDEO_THUMBNAIL = "[data-e2e='user-post-item'] a";

    // --- 동영상 페이지 ---
    public static final String VIDEO_READY = "[data-e2e='browse-like-count']";
    public static final String VIDEO_DETAIL_PANEL = "[class*='DivBrowserModeContainer']";
    public static final String CREATOR_FEED_BUTTON = "[data-e2e='browse-creator-videos']";
    public static final String CLOSE_BUTTON = "[data-e2e='browse-close']";

    // --- 크리에이터 피드 ---
    public static final String CREATOR_FEED_READY = "[data-e2e='creator-feed-list']";
    public static final String CREATOR_FEED_ITEM = "[data-e2e='creator-feed-item']";

    // --- 이상 화면 ---
    public static final String ACCOUNT_REMOVED = "[data-e2e='user-not-found'], [data-e2e='user-banned']";
    public static final String CHALLENGE = "#captcha-verify-image, #captcha_container, [class*='captcha-verify-container']";
    public static final String LOGGED_OUT = "[data-e2e='top-login-button']";

    /** 화면 전환 대기 시 목적지 요소 대신 나타날 수 있는 이상 화면 표식 */
    public static final String ANOMALY_SIGNATURES = ACCOUNT_REMOVED + ", " + CHALLENGE + ", " + LOGGED_OUT;

    // --- 로그인 ---
    public static final String LOGIN_USERNAME = "input[name='username']";
    public static final String LOGIN_PASSWORD = "input[type='password']";
    public static final String LOGIN_SUBMIT = "button[type='submit']";
    public static final String PROFILE_ICON = "[data-e2e='profile-icon']";
}
