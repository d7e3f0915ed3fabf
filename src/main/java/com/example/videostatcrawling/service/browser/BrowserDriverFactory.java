package com.example.videostatcrawling.service.browser;

import com.example.videostatcrawling.entity.CrawlerIdentity;

/**
 * 크롤러 계정별 브라우저 세션 생성기 (프록시 등 계정별 설정 반영)
 */
@FunctionalInterface
public interface BrowserDriverFactory {

    BrowserDriver open(CrawlerIdentity identity);
}
