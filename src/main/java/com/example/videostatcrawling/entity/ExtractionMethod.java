package com.example.videostatcrawling.entity;

/**
 * 레코드가 어떤 추출 경로로 만들어졌는지 나타내는 출처 태그
 * 
 * HEAVY: 동영상 상세 페이지 1건 → 전체 상세 스냅샷
 * LIGHT: 게시자 목록(앞 절반) + 크리에이터 피드(뒤 절반) 병합 → 축약 스냅샷
 */
public enum ExtractionMethod {
    /** 동영상 상세 페이지에서 직접 추출 */
    VIDEO_PAGE,

    /** 게시자 페이지 목록 + 크리에이터 피드 썸네일 키 병합 */
    PUBLISHER_LISTING_MERGE
}
