package com.example.videostatcrawling.config;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.service.browser.BrowserDriverFactory;
import com.example.videostatcrawling.service.browser.SeleniumBrowserDriver;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.*;

/**
 * Selenium WebDriver 설정 클래스
 * 
 * 크롤러 계정마다 독립된 Chrome 세션을 생성하는 {@link BrowserDriverFactory} 를 제공합니다.
 * - 로컬 환경: ChromeDriver 사용 (드라이버 경로 미지정 시 Selenium Manager 가 자동으로 준비)
 * - Docker 환경: RemoteWebDriver 사용 (Selenium Grid)
 * 
 * 봇 탐지 회피를 위한 옵션:
 * - 자동화 배지 제거
 * - User-Agent 로테이션
 * - 계정별 프록시 (--proxy-server)
 * - 최대화 창, 초기 마우스 움직임
 */
@Slf4j
@Configuration
public class SeleniumConfig {

    /** Selenium Hub URL (Docker 환경에서 사용) */
    @Value("${selenium.hub.url:http://localhost:4444/wd/hub}")
    private String seleniumHubUrl;

    /** Remote WebDriver 사용 여부 (Docker 환경: true, 로컬 환경: false) */
    @Value("${selenium.use.remote:false}")
    private boolean useRemoteDriver;

    /** 로컬 chromedriver 경로 (비우면 Selenium Manager 사용) */
    @Value("${selenium.chrome.driver-path:}")
    private String chromeDriverPath;

    @Value("${selenium.headless:false}")
    private boolean headless;

    /**
     * 크롤러 계정별 브라우저 생성기 Bean
     * 
     * 생성 시점에 브라우저를 띄우지 않고, 스케줄러가 계정을 배정받은 뒤에 open() 으로 띄웁니다.
     */
    @Bean
    public BrowserDriverFactory browserDriverFactory(CrawlerProperties properties) {
        if (!useRemoteDriver && StringUtils.hasText(chromeDriverPath)) {
            System.setProperty("webdriver.chrome.driver", chromeDriverPath);
        }
        return identity -> new SeleniumBrowserDriver(createWebDriver(identity), properties.getNavigation());
    }

    private WebDriver createWebDriver(CrawlerIdentity identity) {
        ChromeOptions options = createChromeOptions(identity.getProxy());

        if (useRemoteDriver) {
            try {
                return new RemoteWebDriver(new URL(seleniumHubUrl), options);
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Selenium Hub URL이 올바르지 않습니다: " + seleniumHubUrl, e);
            }
        }

        WebDriver driver = new ChromeDriver(options);
        postCreateTuning(driver);
        log.info("크롤러 계정 {} 용 Chrome 드라이버 설정이 완료되었습니다. (프록시: {})",
                identity.getUsername(), StringUtils.hasText(identity.getProxy()) ? identity.getProxy() : "없음");
        return driver;
    }

    /**
     * Chrome 브라우저 옵션 생성
     *
     * @param proxy 계정별 프록시 (host:port, 없으면 직접 연결)
     */
    private ChromeOptions createChromeOptions(String proxy) {
        ChromeOptions options = new ChromeOptions();

        if (useRemoteDriver || headless) {
            options.addArguments("--headless=new");
        }

        if (StringUtils.hasText(proxy)) {
            options.addArguments("--proxy-server=" + proxy);
        }

        // 자동화 배지 최소화 (navigator.webdriver 속성 감추기)
        options.setExperimentalOption("excludeSwitches", Collections.singletonList("enable-automation"));
        options.setExperimentalOption("useAutomationExtension", false);
        options.addArguments("--disable-blink-features=AutomationControlled");

        options.addArguments("user-agent=" + pickUserAgent());

        // 썸네일 src 가 창 크기에 따라 달라지므로 최대화 상태로 시작 (병합 키 안정화)
        options.addArguments("--start-maximized");

        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-extensions");

        return options;
    }

    /**
     * WebDriver 생성 후 추가 튜닝 (초기 마우스 움직임, navigator.webdriver 우회)
     */
    private void postCreateTuning(WebDriver driver) {
        Humanizer.subtleMouseMove(driver);
        Humanizer.randomSleep(300, 900);

        try {
            ((JavascriptExecutor) driver).executeScript(
                    "Object.defineProperty(navigator, 'webdriver', {get: () => undefined})");
        } catch (WebDriverException e) {
            log.debug("navigator.webdriver 우회 실패: {}", e.getMessage());
        }
    }

    private String pickUserAgent() {
        List<String> agents = Arrays.asList(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 13_6_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36"
        );
        return agents.get(new Random().nextInt(agents.size()));
    }
}
