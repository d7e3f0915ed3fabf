package com.example.videostatcrawling.service.scheduler;

import com.example.videostatcrawling.service.session.AbortReason;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

/**
 * 크롤러 계정 1개의 배치 처리 결과 (해당 계정 스레드 안에서만 갱신)
 */
@Getter
public class IdentityRunResult {

    private final Long identityId;
    private int targetsDispatched;
    private int completed;
    private final Map<AbortReason, Integer> aborted = new EnumMap<>(AbortReason.class);
    private int heavySaved;
    private int lightSaved;
    /** 로그인 실패, 브라우저 실행 실패 등으로 대상 처리 전에 중단 */
    private boolean failedBeforeTargets;

    public IdentityRunResult(Long identityId) {
        this.identityId = identityId;
    }

    void dispatched() {
        targetsDispatched++;
    }

    void completed() {
        completed++;
    }

    void aborted(AbortReason reason) {
        aborted.merge(reason, 1, Integer::sum);
    }

    void saved(int heavy, int light) {
        heavySaved += heavy;
        lightSaved += light;
    }

    void failedBeforeTargets() {
        failedBeforeTargets = true;
    }
}
