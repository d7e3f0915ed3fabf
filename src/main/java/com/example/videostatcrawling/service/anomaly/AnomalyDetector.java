package com.example.videostatcrawling.service.anomaly;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.service.browser.BrowserDriver;
import com.example.videostatcrawling.service.navigation.PageLocators;
import com.example.videostatcrawling.service.navigation.Screen;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 이상 화면 감지기
 * 
 * 화면 전환 직후, 추출 전에 호출됩니다. NORMAL 이 아닌 화면에서는 추출을 실행하지 않습니다.
 * 
 * 판정 순서:
 * 1. 인증(CAPTCHA) 화면 (모든 화면 공통)
 * 2. 로그아웃 표식 (크롤러 계정 차단)
 * 3. 게시자 페이지: 계정 삭제 표식
 * 4. 목록 화면: 제한된 횟수만큼 스크롤해도 아이템이 0개면 EMPTY_CONTENT
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private final CrawlerProperties properties;

    /**
     * @param driver 현재 브라우저
     * @param screen 탐색 상태 머신이 방금 도착한 화면
     * @return 판정 결과
     */
    public ScreenClassification classify(BrowserDriver driver, Screen screen) {
        ScreenClassification interstitial = classifyInterstitial(driver);
        if (!interstitial.isNormal()) {
            return interstitial;
        }

        switch (screen) {
            case PUBLISHER_PAGE:
                if (present(driver, PageLocators.ACCOUNT_REMOVED)) {
                    return ScreenClassification.ACCOUNT_REMOVED;
                }
                return classifyListing(driver, PageLocators.PUBLISHER_ITEM);
            case VIDEO_PAGE_WITH_CREATOR_FEED:
                return classifyListing(driver, PageLocators.CREATOR_FEED_ITEM);
            default:
                return ScreenClassification.NORMAL;
        }
    }

    /**
     * 화면 종류와 상관없는 이상 화면(인증, 로그아웃)만 확인
     * 
     * 목록 확인이 필요 없는 복귀 직후 등에 사용합니다.
     */
    public ScreenClassification classifyInterstitial(BrowserDriver driver) {
        if (present(driver, PageLocators.CHALLENGE)) {
            return ScreenClassification.CHALLENGE_SCREEN;
        }
        if (present(driver, PageLocators.LOGGED_OUT)) {
            return ScreenClassification.IDENTITY_BLOCKED;
        }
        return ScreenClassification.NORMAL;
    }

    /**
     * 목록이 비어 있으면 몇 번 스크롤해 보고, 그래도 비어 있으면 EMPTY_CONTENT
     */
    private ScreenClassification classifyListing(BrowserDriver driver, String itemLocator) {
        int attempts = properties.getScroll().getEmptyContentAttempts();
        for (int attempt = 0; ; attempt++) {
            if (present(driver, itemLocator)) {
                return ScreenClassification.NORMAL;
            }
            if (attempt >= attempts) {
                break;
            }
            log.debug("목록 아이템이 없어 스크롤 후 다시 확인합니다. ({}/{})", attempt + 1, attempts);
            driver.scroll(properties.getScroll().getAmountPx());
            // 스크롤 도중 인증 화면이 뜰 수 있음
            ScreenClassification interstitial = classifyInterstitial(driver);
            if (!interstitial.isNormal()) {
                return interstitial;
            }
        }
        return ScreenClassification.EMPTY_CONTENT;
    }

    private boolean present(BrowserDriver driver, String locator) {
        return !driver.extract(locator).isEmpty();
    }
}
