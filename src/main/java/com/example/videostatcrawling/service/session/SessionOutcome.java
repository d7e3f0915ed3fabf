package com.example.videostatcrawling.service.session;

import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.service.navigation.Screen;
import lombok.Getter;

import java.util.List;

/**
 * 크롤링 세션 1회의 결과
 * 
 * 중단된 세션도 중단 전에 추출을 마친 레코드는 그대로 담고 있습니다.
 */
@Getter
public class SessionOutcome {

    private final SessionState state;
    /** DONE 이면 null */
    private final AbortReason abortReason;
    private final List<HeavyVideoRecord> heavyRecords;
    private final List<LightVideoRecord> lightRecords;
    /** 정리 단계 후 브라우저 화면 */
    private final Screen finalScreen;

    private SessionOutcome(SessionState state, AbortReason abortReason, List<HeavyVideoRecord> heavyRecords,
                           List<LightVideoRecord> lightRecords, Screen finalScreen) {
        this.state = state;
        this.abortReason = abortReason;
        this.heavyRecords = List.copyOf(heavyRecords);
        this.lightRecords = List.copyOf(lightRecords);
        this.finalScreen = finalScreen;
    }

    public static SessionOutcome done(List<HeavyVideoRecord> heavyRecords, List<LightVideoRecord> lightRecords,
                                      Screen finalScreen) {
        return new SessionOutcome(SessionState.DONE, null, heavyRecords, lightRecords, finalScreen);
    }

    public static SessionOutcome aborted(AbortReason reason, List<HeavyVideoRecord> heavyRecords,
                                         List<LightVideoRecord> lightRecords, Screen finalScreen) {
        return new SessionOutcome(SessionState.ABORTED, reason, heavyRecords, lightRecords, finalScreen);
    }

    public boolean isDone() {
        return state == SessionState.DONE;
    }

    public boolean isAborted(AbortReason reason) {
        return state == SessionState.ABORTED && abortReason == reason;
    }
}
