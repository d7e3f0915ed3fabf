package com.example.videostatcrawling.service.merge;

import lombok.Builder;
import lombok.Value;

/**
 * 게시자 페이지 목록 아이템에서 얻은 앞 절반 조각
 */
@Value
@Builder
public class FrontHalfFragment {
    String url;
    String videoId;
    /** 병합 키 */
    String thumbnailUrl;
    String altText;
    String likeCountText;
}
