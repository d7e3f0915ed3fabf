package com.example.videostatcrawling.service.navigation;

import lombok.Getter;

/**
 * 화면 전환 후 목적지 요소가 제한 시간 안에 나타나지 않았거나 전환 버튼이 없을 때 발생
 * 
 * 재시도 가능한 실패이며 계정 생존 여부에는 영향을 주지 않습니다.
 */
@Getter
public class NavigationStuckException extends RuntimeException {

    private final Transition transition;

    public NavigationStuckException(Transition transition, String message) {
        super(transition + ": " + message);
        this.transition = transition;
    }

    public NavigationStuckException(Transition transition, String message, Throwable cause) {
        super(transition + ": " + message, cause);
        this.transition = transition;
    }
}
