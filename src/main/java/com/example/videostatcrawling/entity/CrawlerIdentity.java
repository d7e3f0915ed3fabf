package com.example.videostatcrawling.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 크롤러 계정(Identity) 엔티티
 * 
 * 브라우저 세션을 구동하는 로그인 계정과 선택적인 프록시 경로를 저장합니다.
 * 삭제되지 않으며, 차단/로그아웃이 감지되면 alive=false 로만 표시됩니다.
 */
@Entity
@Table(name = "crawler_accounts")
@Getter
@Setter
@NoArgsConstructor
public class CrawlerIdentity {

    /** Primary Key, 자동 증가 */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 로그인 아이디 (이메일 또는 사용자명) */
    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false)
    private String password;

    /** 프록시 (host:port 형식, 미설정 가능) */
    private String proxy;

    /** 생존 여부 (차단/로그아웃 감지 시 false) */
    @Column(name = "is_alive", nullable = false)
    private boolean alive;

    /** 마지막으로 배정(사용)된 시간 (처음이면 null) */
    private LocalDateTime lastUsedAt;

    @Builder
    public CrawlerIdentity(String username, String password, String proxy, boolean alive, LocalDateTime lastUsedAt) {
        this.username = username;
        this.password = password;
        this.proxy = proxy;
        this.alive = alive;
        this.lastUsedAt = lastUsedAt;
    }
}
