package com.example.videostatcrawling.service.session;

import com.example.videostatcrawling.service.anomaly.ScreenClassification;

/**
 * 세션 중단 사유
 */
public enum AbortReason {
    /** 게시자 계정 삭제 (종료, 대상 계정 alive=false) */
    ACCOUNT_REMOVED,
    /** 인증 화면 (재시도 가능, 크롤러 계정 교체 권장) */
    CHALLENGE_SCREEN,
    /** 목록이 비어 있음 (패널티 없는 조기 종료) */
    EMPTY_CONTENT,
    /** 화면 전환 실패 (재시도 가능) */
    NAVIGATION_STUCK,
    /** 추출 결과가 비어 있음 (재시도 가능) */
    NO_USABLE_DATA,
    /** 크롤러 계정 로그아웃/차단 */
    IDENTITY_BLOCKED,
    /** 예상하지 못한 오류 (재시도 가능) */
    UNEXPECTED_ERROR;

    public static AbortReason from(ScreenClassification classification) {
        switch (classification) {
            case ACCOUNT_REMOVED:
                return ACCOUNT_REMOVED;
            case CHALLENGE_SCREEN:
                return CHALLENGE_SCREEN;
            case EMPTY_CONTENT:
                return EMPTY_CONTENT;
            case IDENTITY_BLOCKED:
                return IDENTITY_BLOCKED;
            default:
                throw new IllegalArgumentException("정상 화면은 중단 사유가 아닙니다: " + classification);
        }
    }
}
