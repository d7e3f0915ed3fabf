package com.example.videostatcrawling.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 크롤러 공통 Bean 설정
 */
@Configuration
@EnableConfigurationProperties(CrawlerProperties.class)
public class CrawlerConfig {

    /**
     * 수집 시간 기준 시계 (테스트에서는 고정 시계로 대체)
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
