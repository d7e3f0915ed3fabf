package com.example.videostatcrawling.service.navigation;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.service.browser.BrowserDriver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 화면 탐색 상태 머신
 * 
 * 허용된 전환({@link Transition})만 실행하며, 각 전환은 브라우저 동작 1회 + 목적지 확인으로 이루어집니다.
 * 목적지가 제한 시간 안에 확인되지 않으면 {@link NavigationStuckException} 을 던지고
 * 현재 화면을 ANY_PAGE(알 수 없음)로 되돌립니다.
 * 
 * 크롤러 계정(브라우저) 1개당 1개 인스턴스이며 대상 계정이 바뀌어도 같은 인스턴스를 이어서 사용합니다.
 */
@Slf4j
public class NavigationStateMachine {

    private final BrowserDriver driver;
    private final String baseUrl;
    private final Duration timeout;

    private Screen currentScreen = Screen.ANY_PAGE;

    /** 마지막으로 진입한 게시자 페이지 URL (복귀용) */
    private String publisherUrl;

    public NavigationStateMachine(BrowserDriver driver, CrawlerProperties properties) {
        this.driver = driver;
        this.baseUrl = properties.getBaseUrl();
        this.timeout = properties.getNavigation().getTimeout();
    }

    public Screen getCurrentScreen() {
        return currentScreen;
    }

    /**
     * 게시자 페이지로 직접 이동 (어느 화면에서든 가능)
     *
     * @param username 게시자 사용자명
     */
    public void enterPublisherPage(String username) {
        publisherUrl = baseUrl + "/@" + username;
        apply(Transition.ENTER_PUBLISHER_PAGE);
    }

    public void openNewestVideo() {
        apply(Transition.OPEN_NEWEST_VIDEO);
    }

    public void openCreatorFeed() {
        apply(Transition.OPEN_CREATOR_FEED);
    }

    /**
     * 동영상 화면에서 닫기 버튼으로 게시자 페이지 복귀
     */
    public void closeToPublisherPage() {
        apply(currentScreen == Screen.VIDEO_PAGE_WITH_CREATOR_FEED
                ? Transition.CLOSE_CREATOR_FEED
                : Transition.CLOSE_VIDEO);
    }

    /**
     * 정리 단계: 어떤 상태에서든 게시자 페이지로 돌아가기를 시도 (예외를 던지지 않음)
     * 
     * 동영상 화면이면 닫기 버튼을 먼저 시도하고, 실패하거나 화면을 알 수 없으면 URL 로 다시 진입합니다.
     *
     * @return 게시자 페이지로 돌아왔으면 true
     */
    public boolean returnToPublisherPage() {
        if (currentScreen == Screen.PUBLISHER_PAGE) {
            return true;
        }
        if (currentScreen == Screen.VIDEO_PAGE || currentScreen == Screen.VIDEO_PAGE_WITH_CREATOR_FEED) {
            try {
                closeToPublisherPage();
                return true;
            } catch (NavigationStuckException e) {
                log.warn("닫기 버튼으로 복귀하지 못했습니다. URL 로 다시 진입합니다: {}", e.getMessage());
            }
        }
        if (publisherUrl == null) {
            return false;
        }
        try {
            apply(Transition.ENTER_PUBLISHER_PAGE);
            return true;
        } catch (NavigationStuckException e) {
            log.warn("게시자 페이지 재진입 실패. 다음 대상은 URL 직접 이동으로 시작합니다: {}", e.getMessage());
            return false;
        }
    }

    private void apply(Transition transition) {
        if (!transition.isLegalFrom(currentScreen)) {
            throw new IllegalStateException("허용되지 않은 화면 전환입니다: " + currentScreen + " -> " + transition);
        }

        boolean acted;
        try {
            acted = perform(transition);
        } catch (RuntimeException e) {
            currentScreen = Screen.ANY_PAGE;
            throw new NavigationStuckException(transition, "브라우저 동작 실패", e);
        }
        if (!acted) {
            // 버튼이 없으면 브라우저는 움직이지 않았으므로 현재 화면 유지
            throw new NavigationStuckException(transition, "전환 버튼을 찾을 수 없습니다");
        }

        if (!driver.waitFor(transition.getTo().readinessLocator(), timeout)) {
            currentScreen = Screen.ANY_PAGE;
            throw new NavigationStuckException(transition, timeout.toMillis() + "ms 안에 화면이 나타나지 않았습니다");
        }
        log.debug("화면 전환 완료: {} -> {}", currentScreen, transition.getTo());
        currentScreen = transition.getTo();
    }

    private boolean perform(Transition transition) {
        switch (transition) {
            case ENTER_PUBLISHER_PAGE:
                driver.navigate(publisherUrl);
                return true;
            case OPEN_NEWEST_VIDEO:
                return driver.click(PageLocators.NEWEST_VIDEO_THUMBNAIL);
            case OPEN_CREATOR_FEED:
                return driver.click(PageLocators.CREATOR_FEED_BUTTON);
            case CLOSE_VIDEO:
            case CLOSE_CREATOR_FEED:
                return driver.click(PageLocators.CLOSE_BUTTON);
            default:
                throw new IllegalArgumentException("알 수 없는 전환: " + transition);
        }
    }
}
