package com.example.videostatcrawling.service.scheduler;

import com.example.videostatcrawling.repository.CrawlerIdentityRepository;
import com.example.videostatcrawling.repository.HeavyVideoRecordRepository;
import com.example.videostatcrawling.repository.LightVideoRecordRepository;
import com.example.videostatcrawling.repository.TargetAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 현황 조회 (DB 집계 + 실시간 세션 카운터)
 */
@Service
@RequiredArgsConstructor
public class CrawlStatusService {

    private final CrawlerIdentityRepository crawlerIdentityRepository;
    private final TargetAccountRepository targetAccountRepository;
    private final HeavyVideoRecordRepository heavyVideoRecordRepository;
    private final LightVideoRecordRepository lightVideoRecordRepository;
    private final CrawlProgressTracker progressTracker;

    @Transactional(readOnly = true)
    public Map<String, Long> getStatus() {
        Map<String, Long> status = new LinkedHashMap<>();
        status.put("aliveIdentities", crawlerIdentityRepository.countByAliveTrue());
        status.put("aliveTargets", targetAccountRepository.countByAliveTrue());
        status.put("heavyRecords", heavyVideoRecordRepository.count());
        status.put("lightRecords", lightVideoRecordRepository.count());
        status.put("sessionsInFlight", progressTracker.getInFlightCount());
        status.put("sessionsCompleted", progressTracker.getCompletedCount());
        status.put("sessionsAborted", progressTracker.getAbortedCount());
        return status;
    }
}
