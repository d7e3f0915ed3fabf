package com.example.videostatcrawling.service.scheduler;

import com.example.videostatcrawling.service.session.AbortReason;
import lombok.Getter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤링 실행 1회의 요약
 */
@Getter
public class CrawlRunReport {

    private final int identitiesUsed;
    private final int targetsDispatched;
    private final int completed;
    private final Map<AbortReason, Integer> aborted;
    private final int heavySaved;
    private final int lightSaved;
    /** 대상 계정을 하나도 처리하지 못하고 중단됨 (계정 없음, 로그인 실패 등) */
    private final boolean abortedBeforeAnyTarget;

    private CrawlRunReport(int identitiesUsed, int targetsDispatched, int completed, Map<AbortReason, Integer> aborted,
                           int heavySaved, int lightSaved, boolean abortedBeforeAnyTarget) {
        this.identitiesUsed = identitiesUsed;
        this.targetsDispatched = targetsDispatched;
        this.completed = completed;
        this.aborted = aborted;
        this.heavySaved = heavySaved;
        this.lightSaved = lightSaved;
        this.abortedBeforeAnyTarget = abortedBeforeAnyTarget;
    }

    /** 사용 가능한 크롤러 계정이 없어 시작하지 못함 */
    public static CrawlRunReport noIdentity() {
        return new CrawlRunReport(0, 0, 0, new EnumMap<>(AbortReason.class), 0, 0, true);
    }

    public static CrawlRunReport of(List<IdentityRunResult> results) {
        int dispatched = 0;
        int completed = 0;
        int heavy = 0;
        int light = 0;
        boolean anyFailedBeforeTargets = false;
        Map<AbortReason, Integer> aborted = new EnumMap<>(AbortReason.class);
        for (IdentityRunResult result : results) {
            dispatched += result.getTargetsDispatched();
            completed += result.getCompleted();
            heavy += result.getHeavySaved();
            light += result.getLightSaved();
            anyFailedBeforeTargets |= result.isFailedBeforeTargets();
            result.getAborted().forEach((reason, count) -> aborted.merge(reason, count, Integer::sum));
        }
        return new CrawlRunReport(results.size(), dispatched, completed, aborted, heavy, light,
                dispatched == 0 && anyFailedBeforeTargets);
    }

    public int abortedCount(AbortReason reason) {
        return aborted.getOrDefault(reason, 0);
    }

    @Override
    public String toString() {
        return String.format("크롤러 계정 %d개, 대상 %d개 처리 (완료 %d, 중단 %s), Heavy %d건, Light %d건",
                identitiesUsed, targetsDispatched, completed, aborted, heavySaved, lightSaved);
    }
}
