package com.example.videostatcrawling.service.merge;

import lombok.Builder;
import lombok.Value;

/**
 * 크리에이터 피드 아이템에서 얻은 뒤 절반 조각 (썸네일 키만 있음)
 */
@Value
@Builder
public class BackHalfFragment {
    /** 병합 키 */
    String thumbnailUrl;
    String playCountText;
}
