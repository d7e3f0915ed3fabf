package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 크롤링 엔진이 의존하는 저장소 포트
 * 
 * 스케줄러/세션은 이 인터페이스만 사용하며, 실제 구현은 {@link JpaCrawlRepository} 입니다.
 * 여러 크롤러 계정 스레드가 동시에 호출하므로 구현체는 행 단위 원자적 갱신을 보장해야 합니다.
 */
public interface CrawlRepository {

    /**
     * 사용 가능한 크롤러 계정을 배정합니다.
     *
     * @param requestedId 특정 계정을 지정할 경우 그 ID (null 이면 가장 오래 쉬었던 계정)
     * @return 배정된 계정 (없으면 Optional.empty())
     */
    Optional<CrawlerIdentity> nextIdentity(Long requestedId);

    /**
     * 크롤러 계정이 처리할 대상 목록을 순서대로 반환합니다.
     * 이미 배정된 대상이 먼저, 부족하면 미배정 대상으로 채웁니다.
     *
     * @param identityId 크롤러 계정 ID
     * @param max 최대 개수
     * @param recrawl true 면 이미 크롤링한 대상도 포함
     */
    List<TargetAccount> nextTargets(Long identityId, int max, boolean recrawl);

    void saveHeavy(HeavyVideoRecord record);

    void saveLight(LightVideoRecord record);

    void markTargetDead(Long targetId);

    void touchTarget(Long targetId, LocalDateTime crawledAt);

    /**
     * @return 배정 성공 여부 (다른 크롤러 계정이 점유 중이면 false)
     */
    boolean assignTarget(Long targetId, Long identityId);

    /**
     * 대상 배정 해제 (아직 이 크롤러 계정에 배정되어 있을 때만)
     * 
     * 재시도 가능한 사유로 세션이 중단된 대상은 다른 크롤러 계정도 가져갈 수 있게 합니다.
     */
    void releaseTarget(Long targetId, Long identityId);

    /**
     * 크롤러 계정 비활성화 + 이 계정에 배정된 대상 모두 배정 해제
     */
    void markIdentityDead(Long identityId);
}
