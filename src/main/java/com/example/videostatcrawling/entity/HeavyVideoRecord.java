package com.example.videostatcrawling.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 동영상 상세 스냅샷 (Heavy) 엔티티
 * 
 * 동영상 상세 페이지에서 1건씩 수집한 관측값입니다.
 * 시계열 데이터이므로 관측할 때마다 새 행으로 추가되며, 저장 후에는 수정하지 않습니다 (Setter 없음).
 * 숫자/날짜 항목은 화면에 표시된 원문(*Text)과 파싱 값(파싱 실패 시 null)을 함께 보관합니다.
 */
@Entity
@Table(name = "video_heavy_raw_data")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HeavyVideoRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 수집 대상 계정 ID */
    @Column(nullable = false)
    private Long targetAccountId;

    /** 플랫폼 동영상 ID (URL에서 추출) */
    private String videoId;

    @Column(length = 1024)
    private String url;

    private String accountUsername;

    private String accountNickname;

    @Column(length = 4000)
    private String title;

    @Column(length = 2048)
    private String thumbnailUrl;

    private String postedAtText;
    private LocalDateTime postedAt;

    private String playCountText;
    private Long playCount;

    private String likeCountText;
    private Long likeCount;

    private String commentCountText;
    private Long commentCount;

    private String collectCountText;
    private Long collectCount;

    private String shareCountText;
    private Long shareCount;

    /** 배경 음원 제목 */
    private String musicTitle;

    @Column(length = 1024)
    private String musicUrl;

    /** 수집(관측) 시간 */
    @Column(nullable = false)
    private LocalDateTime crawledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExtractionMethod extractionMethod;

    @Builder(toBuilder = true)
    public HeavyVideoRecord(Long targetAccountId, String videoId, String url, String accountUsername,
                            String accountNickname, String title, String thumbnailUrl,
                            String postedAtText, LocalDateTime postedAt,
                            String playCountText, Long playCount,
                            String likeCountText, Long likeCount,
                            String commentCountText, Long commentCount,
                            String collectCountText, Long collectCount,
                            String shareCountText, Long shareCount,
                            String musicTitle, String musicUrl,
                            LocalDateTime crawledAt, ExtractionMethod extractionMethod) {
        this.targetAccountId = targetAccountId;
        this.videoId = videoId;
        this.url = url;
        this.accountUsername = accountUsername;
        this.accountNickname = accountNickname;
        this.title = title;
        this.thumbnailUrl = thumbnailUrl;
        this.postedAtText = postedAtText;
        this.postedAt = postedAt;
        this.playCountText = playCountText;
        this.playCount = playCount;
        this.likeCountText = likeCountText;
        this.likeCount = likeCount;
        this.commentCountText = commentCountText;
        this.commentCount = commentCount;
        this.collectCountText = collectCountText;
        this.collectCount = collectCount;
        this.shareCountText = shareCountText;
        this.shareCount = shareCount;
        this.musicTitle = musicTitle;
        this.musicUrl = musicUrl;
        this.crawledAt = crawledAt;
        this.extractionMethod = extractionMethod;
    }
}
