package com.example.videostatcrawling.service.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 동영상 URL 관련 유틸리티
 */
public final class VideoUrls {

    /** https://www.example.com/@user/video/7234567890123456789 형식 */
    private static final Pattern VIDEO_ID_PATTERN = Pattern.compile("/video/(\\d+)");

    /** 인스턴스화 방지 */
    private VideoUrls() {}

    /**
     * URL 에서 동영상 ID 추출
     *
     * @return 동영상 ID (URL 이 null 이거나 형식이 다르면 null)
     */
    public static String videoIdOf(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = VIDEO_ID_PATTERN.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }
}
