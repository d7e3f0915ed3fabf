package com.example.videostatcrawling.service.session;

/**
 * 크롤링 세션 진행 상태
 * 
 * START → LISTING_COLLECTED → LIGHT_MERGED → HEAVY_COLLECTION_LOOP → DONE
 *   ↓ (어느 단계에서든)
 * ABORTED
 */
public enum SessionState {
    START,
    /** 게시자 페이지에서 최신 동영상 목록(앞 절반) 수집 완료 */
    LISTING_COLLECTED,
    /** 크리에이터 피드 뒤 절반 수집 및 병합 완료 */
    LIGHT_MERGED,
    /** 상세 레코드 마무리 (재생 수 보강) */
    HEAVY_COLLECTION_LOOP,
    DONE,
    ABORTED
}
