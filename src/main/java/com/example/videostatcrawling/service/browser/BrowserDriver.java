package com.example.videostatcrawling.service.browser;

import java.time.Duration;
import java.util.List;

/**
 * 브라우저 자동화 포트
 * 
 * 탐색 상태 머신과 크롤링 세션이 사용하는 최소한의 브라우저 동작입니다.
 * 위치 지정자(locator)는 모두 CSS 선택자 문자열입니다.
 * 크롤러 계정 1개당 인스턴스 1개이며 스레드 간 공유하지 않습니다.
 */
public interface BrowserDriver extends AutoCloseable {

    /** URL 로 직접 이동 */
    void navigate(String url);

    /**
     * 첫 번째로 일치하는 요소를 클릭
     *
     * @return 요소가 없어서 클릭하지 못했으면 false
     */
    boolean click(String locator);

    /** 아래로 스크롤 */
    void scroll(int amountPx);

    /**
     * 요소가 나타날 때까지 대기
     *
     * @return 제한 시간 안에 나타났으면 true
     */
    boolean waitFor(String locator, Duration timeout);

    /**
     * 일치하는 모든 요소의 outerHTML 조각을 문서 순서대로 반환 (없으면 빈 목록)
     */
    List<String> extract(String locator);

    /**
     * 입력 필드에 텍스트 입력
     *
     * @return 입력 필드가 없으면 false
     */
    boolean type(String locator, String text);

    String currentUrl();

    String pageSource();

    /** 브라우저 종료 (예외를 던지지 않음) */
    @Override
    void close();
}
