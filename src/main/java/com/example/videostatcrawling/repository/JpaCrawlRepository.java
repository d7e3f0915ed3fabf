package com.example.videostatcrawling.repository;

import com.example.videostatcrawling.entity.CrawlerIdentity;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.entity.TargetAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA 기반 {@link CrawlRepository} 구현체
 * 
 * 전역 락 없이 행 단위 조건부 UPDATE 로 크롤러 계정/대상 계정의 배정과 시간 갱신을 직렬화합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaCrawlRepository implements CrawlRepository {

    /** 배정 후보를 한 번에 몇 개까지 살펴볼지 */
    private static final int IDENTITY_CANDIDATES = 20;

    private final CrawlerIdentityRepository crawlerIdentityRepository;
    private final TargetAccountRepository targetAccountRepository;
    private final HeavyVideoRecordRepository heavyVideoRecordRepository;
    private final LightVideoRecordRepository lightVideoRecordRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<CrawlerIdentity> nextIdentity(Long requestedId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<CrawlerIdentity> candidates;
        if (requestedId != null) {
            candidates = crawlerIdentityRepository.findById(requestedId)
                    .filter(CrawlerIdentity::isAlive)
                    .map(List::of)
                    .orElse(List.of());
        } else {
            candidates = crawlerIdentityRepository.findClaimCandidates(PageRequest.of(0, IDENTITY_CANDIDATES));
        }

        for (CrawlerIdentity candidate : candidates) {
            LocalDateTime previous = candidate.getLastUsedAt();
            int updated = previous == null
                    ? crawlerIdentityRepository.claimUnused(candidate.getId(), now)
                    : crawlerIdentityRepository.claimUsedAt(candidate.getId(), previous, now);
            if (updated == 1) {
                candidate.setLastUsedAt(now);
                return Optional.of(candidate);
            }
            log.debug("크롤러 계정 {} 은(는) 다른 스레드가 먼저 배정했습니다.", candidate.getId());
        }
        return Optional.empty();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TargetAccount> nextTargets(Long identityId, int max, boolean recrawl) {
        if (max <= 0) {
            return List.of();
        }
        List<TargetAccount> result = new ArrayList<>(
                targetAccountRepository.findAssigned(identityId, recrawl, PageRequest.of(0, max)));
        if (result.size() < max) {
            result.addAll(targetAccountRepository.findUnassigned(recrawl, PageRequest.of(0, max - result.size())));
        }
        return result;
    }

    @Override
    @Transactional
    public void saveHeavy(HeavyVideoRecord record) {
        heavyVideoRecordRepository.save(record);
    }

    @Override
    @Transactional
    public void saveLight(LightVideoRecord record) {
        lightVideoRecordRepository.save(record);
    }

    @Override
    @Transactional
    public void markTargetDead(Long targetId) {
        targetAccountRepository.markDead(targetId);
    }

    @Override
    @Transactional
    public void touchTarget(Long targetId, LocalDateTime crawledAt) {
        if (targetAccountRepository.touch(targetId, crawledAt) == 0) {
            log.warn("대상 계정 {} 의 마지막 크롤링 시간이 이미 {} 이후입니다. 갱신하지 않습니다.", targetId, crawledAt);
        }
    }

    @Override
    @Transactional
    public boolean assignTarget(Long targetId, Long identityId) {
        return targetAccountRepository.assign(targetId, identityId) == 1;
    }

    @Override
    @Transactional
    public void releaseTarget(Long targetId, Long identityId) {
        if (targetAccountRepository.release(targetId, identityId) == 0) {
            log.debug("대상 계정 {} 은(는) 크롤러 계정 {} 에 배정되어 있지 않습니다.", targetId, identityId);
        }
    }

    @Override
    @Transactional
    public void markIdentityDead(Long identityId) {
        crawlerIdentityRepository.markDead(identityId);
        int released = targetAccountRepository.releaseAllOf(identityId);
        log.info("크롤러 계정 {} 비활성화. 배정된 대상 {}개를 해제했습니다.", identityId, released);
    }
}
