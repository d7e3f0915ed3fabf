package com.example.videostatcrawling.service.text;

import lombok.Value;

/**
 * 화면에 표시된 원문과 파싱 결과 쌍
 * 
 * 파싱에 실패해도 원문은 그대로 남고 value 만 null 이 됩니다.
 *
 * @param <T> 파싱 결과 타입
 */
@Value
public class ParsedValue<T> {

    /** 화면 원문 (요소 자체가 없었으면 null) */
    String raw;

    /** 파싱 결과 (파싱 실패 시 null) */
    T value;

    public static <T> ParsedValue<T> of(String raw, T value) {
        return new ParsedValue<>(raw, value);
    }

    public static <T> ParsedValue<T> unparsed(String raw) {
        return new ParsedValue<>(raw, null);
    }
}
