package com.example.videostatcrawling.service.session;

import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;
import com.example.videostatcrawling.service.anomaly.AnomalyDetector;
import com.example.videostatcrawling.service.anomaly.ScreenClassification;
import com.example.videostatcrawling.service.browser.BrowserDriver;
import com.example.videostatcrawling.service.extract.ListingExtractor;
import com.example.videostatcrawling.service.extract.VideoPageExtractor;
import com.example.videostatcrawling.service.merge.BackHalfFragment;
import com.example.videostatcrawling.service.merge.FrontHalfFragment;
import com.example.videostatcrawling.service.merge.LightRecordMerger;
import com.example.videostatcrawling.service.navigation.NavigationStateMachine;
import com.example.videostatcrawling.service.navigation.NavigationStuckException;
import com.example.videostatcrawling.service.navigation.PageLocators;
import com.example.videostatcrawling.service.navigation.Screen;
import com.example.videostatcrawling.service.scheduler.CrawlMode;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * (크롤러 계정 × 대상 계정) 1쌍에 대한 크롤링 세션
 * 
 * 동작 순서:
 * 1. 게시자 페이지 직접 진입 → 이상 감지 → 최신 N개 앞 절반 수집
 * 2. 가장 최근 동영상 클릭 → 이상 감지 → 상세(Heavy) 추출
 * 3. 크리에이터 피드 열기 → 이상 감지 → 스크롤하며 뒤 절반 수집 → 병합
 * 4. 상세 레코드에 재생 수 보강
 * 5. 닫기 버튼으로 게시자 페이지 복귀 → 인증/로그아웃 화면 확인
 * 
 * 어떻게 끝나든 finally 에서 게시자 페이지 복귀를 시도하므로,
 * 한 대상의 실패가 다음 대상의 화면 전환 실패로 이어지지 않습니다.
 * 
 * 인스턴스 1개는 1회만 실행합니다.
 */
@Slf4j
public class CrawlSession {

    private final BrowserDriver driver;
    private final NavigationStateMachine navigation;
    private final AnomalyDetector anomalyDetector;
    private final ListingExtractor listingExtractor;
    private final VideoPageExtractor videoPageExtractor;
    private final LightRecordMerger merger;
    private final PageSnapshotWriter snapshotWriter;
    private final TargetAccount target;
    private final CrawlMode mode;
    private final int maxVideos;
    private final int backHalfScrollAttempts;
    private final int scrollAmountPx;
    private final LocalDateTime crawledAt;

    private SessionState state = SessionState.START;
    private final List<HeavyVideoRecord> heavyRecords = new ArrayList<>();
    private final List<LightVideoRecord> lightRecords = new ArrayList<>();

    @Builder
    private CrawlSession(BrowserDriver driver, NavigationStateMachine navigation, AnomalyDetector anomalyDetector,
                         ListingExtractor listingExtractor, VideoPageExtractor videoPageExtractor,
                         LightRecordMerger merger, PageSnapshotWriter snapshotWriter, TargetAccount target,
                         CrawlMode mode, int maxVideos, int backHalfScrollAttempts, int scrollAmountPx,
                         LocalDateTime crawledAt) {
        this.driver = driver;
        this.navigation = navigation;
        this.anomalyDetector = anomalyDetector;
        this.listingExtractor = listingExtractor;
        this.videoPageExtractor = videoPageExtractor;
        this.merger = merger;
        this.snapshotWriter = snapshotWriter;
        this.target = target;
        this.mode = mode;
        this.maxVideos = maxVideos;
        this.backHalfScrollAttempts = backHalfScrollAttempts;
        this.scrollAmountPx = scrollAmountPx;
        this.crawledAt = crawledAt;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * 세션 실행 (예외를 던지지 않음)
     */
    public SessionOutcome run() {
        log.info("[세션 시작] 대상 계정: @{} (모드: {}, 최대 {}개)", target.getUsername(), mode, maxVideos);
        AbortReason abortReason = null;
        try {
            abortReason = crawl();
        } catch (NavigationStuckException e) {
            log.warn("[세션 중단] @{} 화면 전환 실패: {}", target.getUsername(), e.getMessage());
            abortReason = AbortReason.NAVIGATION_STUCK;
        } catch (RuntimeException e) {
            log.error("[세션 중단] @{} 처리 중 예상하지 못한 오류 발생", target.getUsername(), e);
            abortReason = AbortReason.UNEXPECTED_ERROR;
        } finally {
            if (abortReason != null) {
                state = SessionState.ABORTED;
                writeSnapshot(abortReason);
            }
            if (navigation.getCurrentScreen() != Screen.PUBLISHER_PAGE) {
                navigation.returnToPublisherPage();
            }
        }

        if (abortReason != null) {
            return SessionOutcome.aborted(abortReason, heavyRecords, lightRecords, navigation.getCurrentScreen());
        }
        log.info("[세션 완료] @{} Heavy {}건, Light {}건", target.getUsername(), heavyRecords.size(), lightRecords.size());
        return SessionOutcome.done(heavyRecords, lightRecords, navigation.getCurrentScreen());
    }

    /**
     * @return 중단 사유 (정상 완료면 null)
     */
    private AbortReason crawl() {
        // 1. 게시자 페이지
        navigation.enterPublisherPage(target.getUsername());
        AbortReason anomaly = checkScreen(Screen.PUBLISHER_PAGE);
        if (anomaly != null) {
            return anomaly;
        }
        List<FrontHalfFragment> fronts =
                listingExtractor.frontHalves(driver.extract(PageLocators.PUBLISHER_ITEM), maxVideos);
        if (fronts.isEmpty()) {
            log.warn("[추출 실패] @{} 게시자 페이지에서 동영상 링크를 찾지 못했습니다.", target.getUsername());
            return AbortReason.NO_USABLE_DATA;
        }
        state = SessionState.LISTING_COLLECTED;
        log.info("@{} 최신 동영상 {}개를 찾았습니다.", target.getUsername(), fronts.size());

        // 2. 최신 동영상 페이지
        navigation.openNewestVideo();
        anomaly = checkScreen(Screen.VIDEO_PAGE);
        if (anomaly != null) {
            return anomaly;
        }
        HeavyVideoRecord heavy = null;
        if (mode.includesHeavy()) {
            heavy = videoPageExtractor.extract(target.getId(), driver.currentUrl(),
                    driver.extract(PageLocators.VIDEO_DETAIL_PANEL), crawledAt);
            if (heavy == null) {
                log.warn("[추출 실패] @{} 동영상 페이지에서 상세 정보를 찾지 못했습니다.", target.getUsername());
                return AbortReason.NO_USABLE_DATA;
            }
            heavyRecords.add(heavy);
        }

        // 3. 크리에이터 피드
        if (mode.includesLight()) {
            navigation.openCreatorFeed();
            List<BackHalfFragment> backs;
            ScreenClassification classification =
                    anomalyDetector.classify(driver, Screen.VIDEO_PAGE_WITH_CREATOR_FEED);
            if (classification == ScreenClassification.EMPTY_CONTENT) {
                // 앞 절반은 재생 수 없이 저장
                log.info("@{} 크리에이터 피드가 비어 있어 재생 수 없이 병합합니다.", target.getUsername());
                backs = List.of();
            } else if (!classification.isNormal()) {
                log.warn("[이상 감지] @{} 크리에이터 피드 화면: {}", target.getUsername(), classification);
                return AbortReason.from(classification);
            } else {
                backs = collectBackHalves(fronts);
            }
            lightRecords.addAll(merger.merge(target.getId(), fronts, backs, crawledAt));
            state = SessionState.LIGHT_MERGED;
        }

        // 4. 상세 레코드 마무리
        state = SessionState.HEAVY_COLLECTION_LOOP;
        if (heavy != null) {
            heavyRecords.set(0, withPlayCount(heavy));
        }

        // 5. 게시자 페이지 복귀
        navigation.closeToPublisherPage();
        ScreenClassification afterClose = anomalyDetector.classifyInterstitial(driver);
        if (!afterClose.isNormal()) {
            log.warn("[이상 감지] @{} 게시자 페이지 복귀 후: {}", target.getUsername(), afterClose);
            return AbortReason.from(afterClose);
        }
        state = SessionState.DONE;
        return null;
    }

    private AbortReason checkScreen(Screen screen) {
        ScreenClassification classification = anomalyDetector.classify(driver, screen);
        if (classification.isNormal()) {
            return null;
        }
        log.warn("[이상 감지] @{} {} 화면: {}", target.getUsername(), screen, classification);
        return AbortReason.from(classification);
    }

    /**
     * 앞 절반 키가 모두 보이거나 스크롤 한도에 도달할 때까지 뒤 절반 수집
     */
    private List<BackHalfFragment> collectBackHalves(List<FrontHalfFragment> fronts) {
        Map<String, BackHalfFragment> collected = new LinkedHashMap<>();
        long wanted = fronts.stream().map(FrontHalfFragment::getThumbnailUrl).filter(Objects::nonNull).distinct().count();
        for (int attempt = 0; ; attempt++) {
            for (BackHalfFragment back : listingExtractor.backHalves(driver.extract(PageLocators.CREATOR_FEED_ITEM))) {
                collected.putIfAbsent(back.getThumbnailUrl(), back);
            }
            List<BackHalfFragment> backs = new ArrayList<>(collected.values());
            long matched = merger.matchedCount(fronts, backs);
            if (matched >= wanted || attempt >= backHalfScrollAttempts) {
                log.info("@{} 크리에이터 피드에서 {}/{}개의 재생 수를 찾았습니다. (스크롤 {}회)",
                        target.getUsername(), matched, wanted, attempt);
                return backs;
            }
            driver.scroll(scrollAmountPx);
        }
    }

    /**
     * 같은 동영상의 Light 레코드에서 재생 수를 가져와 상세 레코드를 보강
     */
    private HeavyVideoRecord withPlayCount(HeavyVideoRecord heavy) {
        if (heavy.getVideoId() == null) {
            return heavy;
        }
        return lightRecords.stream()
                .filter(light -> heavy.getVideoId().equals(light.getVideoId()))
                .filter(light -> light.getPlayCountText() != null)
                .findFirst()
                .map(light -> heavy.toBuilder()
                        .playCountText(light.getPlayCountText())
                        .playCount(light.getPlayCount())
                        .build())
                .orElse(heavy);
    }

    private void writeSnapshot(AbortReason reason) {
        try {
            snapshotWriter.write(target.getUsername(), reason, crawledAt, driver.pageSource());
        } catch (RuntimeException e) {
            log.warn("[스냅샷] 페이지 소스를 가져오지 못했습니다: {}", e.getMessage());
        }
    }
}
