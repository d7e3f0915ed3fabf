package com.example.videostatcrawling.config;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.*;
import org.openqa.selenium.interactions.Actions;

import java.security.SecureRandom;
import java.time.Duration;

/**
 * Humanizer 유틸리티 클래스
 * 
 * 크롤러 계정이 사람처럼 보이도록 브라우저 동작 사이에 넣는 행동 시뮬레이션 모음입니다.
 * 
 * 주요 기능:
 * - 랜덤 대기 시간
 * - 부드러운 마우스 움직임
 * - 점진적 스크롤
 * - 클릭 전 요소 호버
 * - 인간처럼 타이핑
 * 
 * 시뮬레이션 동작은 부가 기능이므로 실패해도 크롤링을 멈추지 않고 debug 로그만 남깁니다.
 */
@Slf4j
public final class Humanizer {

    /** 안전한 랜덤 숫자 생성기 (암호화 수준) */
    private static final SecureRandom RANDOM = new SecureRandom();

    /** 인스턴스화 방지 */
    private Humanizer() {}

    /**
     * 최소~최대 사이의 랜덤 시간만큼 대기
     *
     * @param minMs 최소 대기 시간 (밀리초)
     * @param maxMs 최대 대기 시간 (밀리초)
     */
    public static void randomSleep(int minMs, int maxMs) {
        int boundMin = Math.max(0, minMs);
        int sleepMs = boundMin + RANDOM.nextInt(Math.max(1, maxMs - boundMin + 1));
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 화면 안의 랜덤한 위치로 마우스를 부드럽게 이동
     *
     * @param driver WebDriver 인스턴스
     */
    public static void subtleMouseMove(WebDriver driver) {
        try {
            Dimension size = driver.manage().window().getSize();
            // 화면의 80% x 70% 범위 내에서 랜덤 위치 선택
            int x = 20 + RANDOM.nextInt(Math.max(1, (int) (size.width * 0.8)));
            int y = 80 + RANDOM.nextInt(Math.max(1, (int) (size.height * 0.7)));
            new Actions(driver).moveByOffset(1, 1).moveByOffset(x, y).pause(Duration.ofMillis(50 + RANDOM.nextInt(200))).perform();
        } catch (WebDriverException e) {
            log.debug("마우스 이동 시뮬레이션 실패: {}", e.getMessage());
        }
    }

    /**
     * 점진적 스크롤
     * 
     * 지정된 픽셀 수를 150~400px 단위로 나누어 내리고, 마지막에 읽는 시간을 흉내 냅니다.
     * 무한 스크롤 목록의 로딩을 방해하지 않도록 위로 되돌리는 동작은 하지 않습니다.
     *
     * @param driver WebDriver 인스턴스
     * @param totalPixels 총 스크롤 픽셀 수 (±25% 랜덤 보정)
     */
    public static void gradualScroll(WebDriver driver, int totalPixels) {
        int jitter = Math.max(1, totalPixels / 4);
        int total = totalPixels - jitter + RANDOM.nextInt(jitter * 2 + 1);
        int scrolled = 0;
        JavascriptExecutor js = (JavascriptExecutor) driver;

        while (scrolled < total) {
            int step = 150 + RANDOM.nextInt(250);
            js.executeScript("window.scrollBy(0, arguments[0]);", step);
            scrolled += step;
            randomSleep(150, 300);
        }

        randomSleep(500, 1500);
    }

    /**
     * 클릭 직전에 대상 요소 위로 마우스를 올려 잠시 머무름
     *
     * @param driver WebDriver 인스턴스
     * @param element 호버할 요소
     */
    public static void hover(WebDriver driver, WebElement element) {
        try {
            new Actions(driver).moveToElement(element).pause(Duration.ofMillis(150 + RANDOM.nextInt(600))).perform();
        } catch (WebDriverException e) {
            log.debug("요소 호버 실패: {}", e.getMessage());
        }
    }

    /**
     * 한 글자씩 입력하며 글자 사이에 랜덤 대기 (가끔 긴 대기 포함)
     *
     * @param input 입력 필드 요소
     * @param text 입력할 텍스트
     */
    public static void typeHumanLike(WebElement input, String text) {
        for (char c : text.toCharArray()) {
            input.sendKeys(String.valueOf(c));
            randomSleep(40, 180);
            // 3% 확률로 생각하는 시간
            if (RANDOM.nextDouble() < 0.03) {
                randomSleep(200, 500);
            }
        }
    }
}
