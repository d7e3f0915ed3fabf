package com.example.videostatcrawling.service.browser;

/**
 * 크롤러 계정 로그인 실패
 * 
 * 해당 계정의 이번 배치는 포기하지만 생존 여부는 바꾸지 않습니다.
 */
public class IdentityLoginException extends RuntimeException {

    public IdentityLoginException(String message) {
        super(message);
    }

    public IdentityLoginException(String message, Throwable cause) {
        super(message, cause);
    }
}
