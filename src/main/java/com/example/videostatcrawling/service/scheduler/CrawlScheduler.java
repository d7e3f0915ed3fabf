package com.example.videostatcrawling.service.scheduler;

import com.example.videostatcrawling.config.CrawlerProperties;
import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;
import com.example.videostatcrawling.repository.CrawlRepository;
import com.example.videostatcrawling.service.browser.BrowserDriver;
import com.example.videostatcrawling.service.browser.BrowserDriverFactory;
import com.example.videostatcrawling.service.browser.IdentityLoginException;
import com.example.videostatcrawling.service.browser.IdentityLoginService;
import com.example.videostatcrawling.service.navigation.NavigationStateMachine;
import com.example.videostatcrawling.service.session.AbortReason;
import com.example.videostatcrawling.service.session.CrawlSessionFactory;
import com.example.videostatcrawling.service.session.SessionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 크롤링 스케줄러
 *
 * 크롤러 계정을 배정받고, 계정마다 브라우저 1개를 열어 로그인한 뒤
 * 배정된 대상 계정을 우선순위 순서로 하나씩 크롤링합니다.
 *
 * 동작 방식:
 * - 계정 지정 시 그 계정 1개만, 아니면 설정된 개수(parallel-identities)만큼 병렬 실행
 * - 실행 전체의 대상 처리 한도(run-budget)는 모든 계정 스레드가 공유
 * - 세션 결과에 따라 레코드 저장, 대상 갱신/비활성화, 계정 교체를 결정
 * - 재시도 가능한 사유로 중단된 대상은 배정을 해제하여 다른 계정이 가져갈 수 있게 함
 * - 한 대상의 실패는 다음 대상 처리에 영향을 주지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlScheduler {

    private final CrawlRepository repository;
    private final BrowserDriverFactory driverFactory;
    private final IdentityLoginService loginService;
    private final CrawlSessionFactory sessionFactory;
    private final CrawlProgressTracker progressTracker;
    private final CrawlerProperties properties;
    private final Clock clock;

    // 이 프로세스 안에서 실행 중인 크롤러 계정 (REST 요청과 시작 시 실행이 겹치는 경우 대비)
    private final Set<Long> activeIdentities = ConcurrentHashMap.newKeySet();

    public CrawlRunReport run(CrawlRunRequest request) {
        CrawlerProperties.Batch batch = properties.getBatch();
        int maxVideos = request.getMaxVideosPerTarget() != null ? request.getMaxVideosPerTarget() : batch.getMaxVideosPerTarget();
        int maxTargets = request.getMaxTargets() != null ? request.getMaxTargets() : batch.getMaxTargets();
        int parallel = request.getIdentityId() != null ? 1 : Math.max(1, batch.getParallelIdentities());
        CrawlBudget budget = new CrawlBudget(batch.getRunBudget());

        log.info("크롤링 실행을 시작합니다. (모드: {}, 계정당 대상 {}개, 대상당 동영상 {}개, 재수집: {}, 전체 한도: {})",
                request.getMode(), maxTargets, maxVideos, request.isRecrawl(), budget.remaining());

        List<CrawlerIdentity> identities = claimIdentities(request.getIdentityId(), parallel);
        if (identities.isEmpty()) {
            log.error("사용 가능한 크롤러 계정이 없습니다. (요청 계정 ID: {})", request.getIdentityId());
            return CrawlRunReport.noIdentity();
        }

        List<IdentityRunResult> results = new ArrayList<>();
        if (identities.size() == 1) {
            results.add(runIdentity(identities.get(0), request, maxTargets, maxVideos, budget));
        } else {
            ExecutorService pool = Executors.newFixedThreadPool(identities.size());
            List<CompletableFuture<IdentityRunResult>> futures = new ArrayList<>();
            for (CrawlerIdentity identity : identities) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> runIdentity(identity, request, maxTargets, maxVideos, budget), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.forEach(future -> results.add(future.join()));

            pool.shutdown();
            try {
                pool.awaitTermination(1, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        CrawlRunReport report = CrawlRunReport.of(results);
        log.info("크롤링 실행 완료. {}", report);
        return report;
    }

    private List<CrawlerIdentity> claimIdentities(Long requestedId, int count) {
        List<CrawlerIdentity> claimed = new ArrayList<>();
        while (claimed.size() < count) {
            Optional<CrawlerIdentity> next = repository.nextIdentity(requestedId);
            if (next.isEmpty()) {
                break;
            }
            CrawlerIdentity identity = next.get();
            if (!activeIdentities.add(identity.getId())) {
                log.warn("크롤러 계정 {} 는 이미 다른 실행에서 사용 중입니다.", identity.getUsername());
                break;
            }
            claimed.add(identity);
            if (requestedId != null) {
                break;
            }
        }
        return claimed;
    }

    /**
     * 크롤러 계정 1개의 배치 처리 (계정 스레드에서 실행, 예외를 던지지 않음)
     */
    private IdentityRunResult runIdentity(CrawlerIdentity identity, CrawlRunRequest request,
                                          int maxTargets, int maxVideos, CrawlBudget budget) {
        IdentityRunResult result = new IdentityRunResult(identity.getId());
        try (BrowserDriver driver = driverFactory.open(identity)) {
            loginService.login(driver, identity);
            NavigationStateMachine navigation = new NavigationStateMachine(driver, properties);

            List<TargetAccount> targets = repository.nextTargets(identity.getId(), maxTargets, request.isRecrawl());
            log.info("크롤러 계정 {} 에 대상 {}개가 배정되었습니다.", identity.getUsername(), targets.size());
            if (targets.isEmpty()) {
                log.info("크롤링할 대상 계정이 없습니다.");
            }

            for (TargetAccount target : targets) {
                if (!budget.tryAcquire()) {
                    log.info("실행 전체 처리 한도에 도달하여 크롤러 계정 {} 의 배치를 종료합니다.", identity.getUsername());
                    break;
                }
                if (!repository.assignTarget(target.getId(), identity.getId())) {
                    budget.release();
                    log.info("대상 {} 는 다른 크롤러 계정에 배정되어 건너뜁니다.", target.getUsername());
                    continue;
                }

                result.dispatched();
                progressTracker.sessionStarted();
                SessionOutcome outcome = sessionFactory.create(driver, navigation, target, request.getMode(), maxVideos).run();
                progressTracker.sessionFinished(outcome.isDone());

                if (!applyOutcome(identity, target, outcome, result)) {
                    log.warn("크롤러 계정 {} 의 배치를 중단하고 계정을 교체합니다. (사유: {})",
                            identity.getUsername(), outcome.getAbortReason());
                    break;
                }
            }
        } catch (IdentityLoginException e) {
            log.error("크롤러 계정 {} 로그인 실패로 배치를 포기합니다: {}", identity.getUsername(), e.getMessage());
            if (result.getTargetsDispatched() == 0) {
                result.failedBeforeTargets();
            }
        } catch (RuntimeException e) {
            log.error("크롤러 계정 {} 처리 중 오류 발생. 배치를 중단합니다: {}", identity.getUsername(), e.getMessage(), e);
            if (result.getTargetsDispatched() == 0) {
                result.failedBeforeTargets();
            }
        } finally {
            activeIdentities.remove(identity.getId());
        }
        return result;
    }

    /**
     * 세션 결과를 저장소에 반영합니다.
     *
     * @return 같은 크롤러 계정으로 다음 대상을 계속 처리해도 되면 true
     */
    private boolean applyOutcome(CrawlerIdentity identity, TargetAccount target, SessionOutcome outcome,
                                 IdentityRunResult result) {
        AbortReason reason = outcome.getAbortReason();
        try {
            for (HeavyVideoRecord record : outcome.getHeavyRecords()) {
                repository.saveHeavy(record);
            }
            for (LightVideoRecord record : outcome.getLightRecords()) {
                repository.saveLight(record);
            }
            result.saved(outcome.getHeavyRecords().size(), outcome.getLightRecords().size());

            if (outcome.isDone()) {
                result.completed();
                repository.touchTarget(target.getId(), LocalDateTime.now(clock));
                log.info("[완료] 대상 {} - Heavy {}건, Light {}건 저장",
                        target.getUsername(), outcome.getHeavyRecords().size(), outcome.getLightRecords().size());
                return true;
            }

            result.aborted(reason);
            log.warn("[중단] 대상 {} - 사유: {}, 저장된 부분 레코드 Heavy {}건, Light {}건",
                    target.getUsername(), reason, outcome.getHeavyRecords().size(), outcome.getLightRecords().size());
            switch (reason) {
                case ACCOUNT_REMOVED:
                    repository.markTargetDead(target.getId());
                    return true;
                case EMPTY_CONTENT:
                    repository.touchTarget(target.getId(), LocalDateTime.now(clock));
                    return true;
                case CHALLENGE_SCREEN:
                    repository.releaseTarget(target.getId(), identity.getId());
                    return false;
                case IDENTITY_BLOCKED:
                    // 배정된 대상도 함께 해제됨
                    repository.markIdentityDead(identity.getId());
                    return false;
                default:
                    repository.releaseTarget(target.getId(), identity.getId());
                    return true;
            }
        } catch (RuntimeException e) {
            log.error("대상 {} 결과 저장 중 오류 발생. 다음 대상으로 진행합니다: {}", target.getUsername(), e.getMessage(), e);
            return true;
        }
    }
}
