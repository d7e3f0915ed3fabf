package com.example.videostatcrawling.config;

import com.example.videostatcrawling.service.scheduler.CrawlMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 크롤러 설정 (application.yml 의 crawler.* 블록)
 */
@Data
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    /** 플랫폼 기본 URL */
    private String baseUrl = "https://www.tiktok.com";

    /** 로그인 페이지 경로 */
    private String loginPath = "/login/phone-or-email/email";

    /** 이상 감지 시 페이지 소스를 저장할 폴더 (비우면 저장 안 함) */
    private String snapshotDir = "snapshots";

    /** 애플리케이션 시작 시 1회 실행 여부 */
    private boolean runOnStartup = false;

    private Navigation navigation = new Navigation();
    private Scroll scroll = new Scroll();
    private Batch batch = new Batch();
    private Startup startup = new Startup();

    @Data
    public static class Navigation {
        /** 화면 전환 후 대상 요소가 나타날 때까지 기다리는 최대 시간 */
        private Duration timeout = Duration.ofSeconds(10);
        /** 로그인 완료(프로필 아이콘)까지 기다리는 최대 시간 */
        private Duration loginTimeout = Duration.ofSeconds(60);
        /** 동작 사이 랜덤 대기 (밀리초) */
        private int waitMinMs = 2000;
        private int waitMaxMs = 5000;
    }

    @Data
    public static class Scroll {
        /** 1회 스크롤 픽셀 수 */
        private int amountPx = 900;
        /** 게시자 페이지가 비어 보일 때 추가로 스크롤해 볼 횟수 */
        private int emptyContentAttempts = 3;
        /** 크리에이터 피드에서 뒤 절반을 찾기 위한 최대 스크롤 횟수 */
        private int backHalfAttempts = 10;
    }

    @Data
    public static class Batch {
        /** 대상 계정당 수집할 최신 동영상 수 */
        private int maxVideosPerTarget = 30;
        /** 크롤러 계정 1개가 한 번에 처리할 대상 계정 수 */
        private int maxTargets = 5;
        /** 실행 1회당 전체 대상 계정 처리 한도 */
        private int runBudget = 100;
        /** 동시에 실행할 크롤러 계정 수 */
        private int parallelIdentities = 1;
    }

    /** run-on-startup 실행 파라미터 (--crawler.startup.mode=both 형식으로 지정 가능) */
    @Data
    public static class Startup {
        private CrawlMode mode = CrawlMode.BOTH;
        private Long identityId;
        private Integer maxVideos;
        private Integer maxTargets;
        private boolean recrawl = false;
    }
}
