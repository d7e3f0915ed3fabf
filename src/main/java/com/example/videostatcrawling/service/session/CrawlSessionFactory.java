package com.example.videostatcrawling.service.session;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.entity.TargetAccount;
import com.example.videostatcrawling.service.anomaly.AnomalyDetector;
import com.example.videostatcrawling.service.browser.BrowserDriver;
import com.example.videostatcrawling.service.extract.ListingExtractor;
import com.example.videostatcrawling.service.extract.VideoPageExtractor;
import com.example.videostatcrawling.service.merge.LightRecordMerger;
import com.example.videostatcrawling.service.navigation.NavigationStateMachine;
import com.example.videostatcrawling.service.scheduler.CrawlMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 상태가 없는 공용 컴포넌트와 세션별 상태(브라우저, 탐색 상태 머신, 대상)를 묶어 CrawlSession 을 만듭니다.
 */
@Component
@RequiredArgsConstructor
public class CrawlSessionFactory {

    private final AnomalyDetector anomalyDetector;
    private final ListingExtractor listingExtractor;
    private final VideoPageExtractor videoPageExtractor;
    private final LightRecordMerger merger;
    private final PageSnapshotWriter snapshotWriter;
    private final CrawlerProperties properties;
    private final Clock clock;

    public CrawlSession create(BrowserDriver driver, NavigationStateMachine navigation, TargetAccount target,
                               CrawlMode mode, int maxVideos) {
        return CrawlSession.builder()
                .driver(driver)
                .navigation(navigation)
                .anomalyDetector(anomalyDetector)
                .listingExtractor(listingExtractor)
                .videoPageExtractor(videoPageExtractor)
                .merger(merger)
                .snapshotWriter(snapshotWriter)
                .target(target)
                .mode(mode)
                .maxVideos(maxVideos)
                .backHalfScrollAttempts(properties.getScroll().getBackHalfAttempts())
                .scrollAmountPx(properties.getScroll().getAmountPx())
                .crawledAt(LocalDateTime.now(clock))
                .build();
    }
}
