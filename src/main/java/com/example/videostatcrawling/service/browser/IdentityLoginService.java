package com.example.videostatcrawling.service.browser;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.service.navigation.PageLocators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 크롤러 계정 로그인
 * 
 * 로그인 페이지 이동 → 아이디/비밀번호 입력 → 제출 → 프로필 아이콘 확인 순서로 진행합니다.
 * 입력은 BrowserDriver 구현체가 한 글자씩 사람처럼 입력합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityLoginService {

    private final CrawlerProperties properties;

    /**
     * @throws IdentityLoginException 입력 필드가 없거나, 인증 화면이 뜨거나, 제한 시간 안에 로그인되지 않은 경우
     */
    public void login(BrowserDriver driver, CrawlerIdentity identity) {
        log.info("크롤러 계정 {} 로 로그인을 시도합니다.", identity.getUsername());
        Duration timeout = properties.getNavigation().getTimeout();

        driver.navigate(properties.getBaseUrl() + properties.getLoginPath());
        if (!driver.waitFor(PageLocators.LOGIN_USERNAME, timeout)) {
            throw new IdentityLoginException("로그인 입력 필드가 나타나지 않았습니다: " + identity.getUsername());
        }
        if (!driver.type(PageLocators.LOGIN_USERNAME, identity.getUsername())
                || !driver.type(PageLocators.LOGIN_PASSWORD, identity.getPassword())) {
            throw new IdentityLoginException("로그인 입력 필드를 찾을 수 없습니다: " + identity.getUsername());
        }
        if (!driver.click(PageLocators.LOGIN_SUBMIT)) {
            throw new IdentityLoginException("로그인 버튼을 찾을 수 없습니다: " + identity.getUsername());
        }

        Duration loginTimeout = properties.getNavigation().getLoginTimeout();
        if (!driver.waitFor(PageLocators.PROFILE_ICON + ", " + PageLocators.CHALLENGE, loginTimeout)) {
            throw new IdentityLoginException(loginTimeout.toSeconds() + "초 안에 로그인되지 않았습니다: " + identity.getUsername());
        }
        if (!driver.extract(PageLocators.CHALLENGE).isEmpty()) {
            throw new IdentityLoginException("로그인 중 인증 화면이 나타났습니다: " + identity.getUsername());
        }
        log.info("크롤러 계정 {} 로그인에 성공했습니다.", identity.getUsername());
    }
}
