package com.example.videostatcrawling.service.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * 크롤링 실행 요청 파라미터 (null 항목은 설정 기본값 사용)
 */
@Value
@Builder
public class CrawlRunRequest {

    @Builder.Default
    CrawlMode mode = CrawlMode.BOTH;

    /** 특정 크롤러 계정만 사용할 경우 그 ID */
    Long identityId;

    /** 대상 계정당 최신 동영상 수 */
    Integer maxVideosPerTarget;

    /** 크롤러 계정당 대상 계정 수 */
    Integer maxTargets;

    /** 이미 크롤링한 대상도 다시 수집 */
    boolean recrawl;
}
