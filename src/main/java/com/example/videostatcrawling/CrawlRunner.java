package com.example.videostatcrawling;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.service.scheduler.CrawlRunReport;
import com.example.videostatcrawling.service.scheduler.CrawlRunRequest;
import com.example.videostatcrawling.service.scheduler.CrawlScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 크롤링 1회 실행 (crawler.run-on-startup=true 일 때만)
 * 
 * 종료 코드: 정상 완료 0, 대상을 하나도 처리하지 못하고 중단되면 1
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "crawler", name = "run-on-startup", havingValue = "true")
public class CrawlRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CrawlScheduler crawlScheduler;
    private final CrawlerProperties properties;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        CrawlerProperties.Startup startup = properties.getStartup();
        CrawlRunRequest request = CrawlRunRequest.builder()
                .mode(startup.getMode())
                .identityId(startup.getIdentityId())
                .maxVideosPerTarget(startup.getMaxVideos())
                .maxTargets(startup.getMaxTargets())
                .recrawl(startup.isRecrawl())
                .build();
        CrawlRunReport report = crawlScheduler.run(request);
        if (report.isAbortedBeforeAnyTarget()) {
            log.error("대상을 하나도 처리하지 못하고 크롤링이 중단되었습니다.");
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
