package com.example.videostatcrawling.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 동영상 축약 스냅샷 (Light) 엔티티
 * 
 * 게시자 페이지 목록의 앞 절반(URL, 썸네일, 좋아요 수, alt 텍스트)과
 * 크리에이터 피드의 뒤 절반(재생 수)을 썸네일 키로 병합한 결과입니다.
 * 뒤 절반을 찾지 못한 경우 재생 수 항목은 null로 저장됩니다.
 */
@Entity
@Table(name = "video_light_raw_data")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LightVideoRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long targetAccountId;

    private String videoId;

    @Column(length = 1024)
    private String url;

    /** 병합 키 */
    @Column(length = 2048)
    private String thumbnailUrl;

    /** 썸네일 alt 텍스트 (보통 동영상 설명이 들어있음) */
    @Column(length = 4000)
    private String altText;

    private String likeCountText;
    private Long likeCount;

    private String playCountText;
    private Long playCount;

    @Column(nullable = false)
    private LocalDateTime crawledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExtractionMethod extractionMethod;

    @Builder
    public LightVideoRecord(Long targetAccountId, String videoId, String url, String thumbnailUrl, String altText,
                            String likeCountText, Long likeCount, String playCountText, Long playCount,
                            LocalDateTime crawledAt, ExtractionMethod extractionMethod) {
        this.targetAccountId = targetAccountId;
        this.videoId = videoId;
        this.url = url;
        this.thumbnailUrl = thumbnailUrl;
        this.altText = altText;
        this.likeCountText = likeCountText;
        this.likeCount = likeCount;
        this.playCountText = playCountText;
        this.playCount = playCount;
        this.crawledAt = crawledAt;
        this.extractionMethod = extractionMethod;
    }
}
