package com.example.videostatcrawling.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 수집 대상 계정(게시자) 엔티티
 * 
 * 시드 데이터로 외부에서 생성되며, 스케줄러가 배정 정보와 마지막 크롤링 시간을,
 * 이상 감지 결과가 생존 여부를 갱신합니다.
 */
@Entity
@Table(name = "target_accounts")
@Getter
@Setter
@NoArgsConstructor
public class TargetAccount {

    /** Primary Key, 자동 증가 */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 게시자 사용자명 (@ 없이 저장) */
    @Column(nullable = false, unique = true)
    private String username;

    /** 배정된 크롤러 계정 ID (미배정이면 null) */
    @Column(name = "crawler_account_id")
    private Long crawlerIdentityId;

    /** 생존 여부 (계정 삭제 감지 시 false) */
    @Column(name = "is_alive", nullable = false)
    private boolean alive;

    /** 정렬용 우선순위 (높을수록 먼저) */
    @Column(name = "crawl_priority", nullable = false)
    private int priority;

    /** 마지막 크롤링 완료 시간 (처음이면 null, 앞으로만 이동) */
    private LocalDateTime lastCrawledAt;

    @Builder
    public TargetAccount(String username, Long crawlerIdentityId, boolean alive, int priority, LocalDateTime lastCrawledAt) {
        this.username = username;
        this.crawlerIdentityId = crawlerIdentityId;
        this.alive = alive;
        this.priority = priority;
        this.lastCrawledAt = lastCrawledAt;
    }
}
