package com.example.videostatcrawling.service.anomaly;

/**
 * 화면 전환 직후 이상 감지 결과
 */
public enum ScreenClassification {

    /** 정상 화면, 추출 진행 */
    NORMAL,

    /** 게시자 계정이 삭제/정지됨 → 대상 계정 alive=false, 세션 종료 */
    ACCOUNT_REMOVED,

    /** 인증(CAPTCHA) 화면 → 세션 종료, 생존 여부 변경 없음, 다른 계정으로 나중에 재시도 */
    CHALLENGE_SCREEN,

    /** 목록이 비어 있음 (스크롤 재시도 후에도) → 세션 조기 종료, 패널티 없음 */
    EMPTY_CONTENT,

    /** 크롤러 계정이 로그아웃/차단됨 → 크롤러 계정 alive=false, 세션 종료 */
    IDENTITY_BLOCKED;

    public boolean isNormal() {
        return this == NORMAL;
    }
}
