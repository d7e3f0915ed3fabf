package com.example.videostatcrawling.service.browser;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.config.Humanizer;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Selenium WebDriver 기반 {@link BrowserDriver} 구현체
 * 
 * 이동/클릭/입력 뒤에는 항상 Humanizer 로 랜덤 대기를 넣어 일정한 간격의 기계적인 동작을 피합니다.
 */
@Slf4j
public class SeleniumBrowserDriver implements BrowserDriver {

    private final WebDriver driver;
    private final CrawlerProperties.Navigation navigation;

    public SeleniumBrowserDriver(WebDriver driver, CrawlerProperties.Navigation navigation) {
        this.driver = driver;
        this.navigation = navigation;
    }

    @Override
    public void navigate(String url) {
        driver.get(url);
        humanPause();
    }

    @Override
    public boolean click(String locator) {
        List<WebElement> elements = driver.findElements(By.cssSelector(locator));
        if (elements.isEmpty()) {
            return false;
        }
        WebElement element = elements.get(0);
        Humanizer.hover(driver, element);
        try {
            element.click();
        } catch (ElementClickInterceptedException e) {
            // 오버레이에 가려진 경우 JavaScript 클릭으로 재시도
            log.debug("클릭이 가로막혀 JavaScript 클릭으로 재시도합니다: {}", locator);
            ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element);
        } catch (StaleElementReferenceException e) {
            log.debug("클릭 대상이 DOM 에서 사라졌습니다: {}", locator);
            return false;
        }
        humanPause();
        return true;
    }

    @Override
    public void scroll(int amountPx) {
        Humanizer.gradualScroll(driver, amountPx);
    }

    @Override
    public boolean waitFor(String locator, Duration timeout) {
        try {
            new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(locator)));
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    @Override
    public List<String> extract(String locator) {
        List<String> fragments = new ArrayList<>();
        for (WebElement element : driver.findElements(By.cssSelector(locator))) {
            try {
                String html = element.getAttribute("outerHTML");
                if (html != null) {
                    fragments.add(html);
                }
            } catch (StaleElementReferenceException e) {
                // 무한 스크롤 중 다시 그려진 요소는 다음 추출에서 잡힘
                log.debug("추출 중 요소가 사라졌습니다: {}", locator);
            }
        }
        return fragments;
    }

    @Override
    public boolean type(String locator, String text) {
        List<WebElement> elements = driver.findElements(By.cssSelector(locator));
        if (elements.isEmpty()) {
            return false;
        }
        WebElement input = elements.get(0);
        Humanizer.hover(driver, input);
        input.click();
        Humanizer.typeHumanLike(input, text);
        Humanizer.randomSleep(1000, 2500);
        return true;
    }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String pageSource() {
        return driver.getPageSource();
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.info("Chrome 드라이버를 종료했습니다.");
        } catch (WebDriverException e) {
            log.warn("Chrome 드라이버 종료 중 오류 발생: {}", e.getMessage());
        }
    }

    private void humanPause() {
        Humanizer.randomSleep(navigation.getWaitMinMs(), navigation.getWaitMaxMs());
    }
}
