package com.example.videostatcrawling.controller;

import com.example.videostatcrawling.service.scheduler.CrawlMode;
import com.example.videostatcrawling.service.scheduler.CrawlRunRequest;
import com.example.videostatcrawling.service.scheduler.CrawlScheduler;
import com.example.videostatcrawling.service.scheduler.CrawlStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 크롤링 제어 REST API 컨트롤러
 * 
 * 동영상 인기 지표 크롤링 실행과 작업 현황 조회 엔드포인트를 제공합니다.
 * 
 * 크롤링은 비동기로 실행되며, 즉시 응답을 반환합니다.
 * 진행 상황은 /status API를 통해 확인할 수 있습니다.
 */
@Tag(name = "Crawling Controller", description = "동영상 인기 지표 크롤링 제어 API")
@RestController
@RequiredArgsConstructor
public class CrawlingController {

    private final CrawlScheduler crawlScheduler;
    private final CrawlStatusService crawlStatusService;

    /**
     * 크롤링 실행 API
     * 
     * 크롤러 계정을 배정받아 로그인한 뒤, 배정된 대상 계정을 우선순위 순서로 크롤링합니다.
     * 
     * 모드:
     * - light: 게시자 페이지 목록 + 크리에이터 피드 병합 (동영상별 Light 레코드)
     * - heavy: 최신 동영상 상세 페이지 (Heavy 레코드 1건)
     * - both: 둘 다
     */
    @Operation(summary = "1. 크롤링 실행",
               description = "크롤러 계정으로 로그인하여 대상 계정들의 최신 동영상 지표를 수집합니다. " +
                       "identityId 를 지정하면 해당 계정만 사용하고, 생략하면 가장 오래 쉬었던 계정부터 배정합니다. " +
                       "recrawl=false 이면 아직 한 번도 크롤링하지 않은 대상만 처리합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "크롤링 작업이 성공적으로 시작됨"),
        @ApiResponse(responseCode = "400", description = "파라미터가 유효한 범위를 벗어남")
    })
    @PostMapping("/crawl")
    public ResponseEntity<String> crawl(
        @Parameter(description = "수집 모드 (light, heavy, both)", example = "both")
        @RequestParam(defaultValue = "both") String mode,
        @Parameter(description = "사용할 크롤러 계정 ID (생략 시 자동 배정)")
        @RequestParam(required = false) Long identityId,
        @Parameter(description = "대상 계정당 최신 동영상 수 (1~200)", example = "30")
        @RequestParam(required = false) Integer maxVideos,
        @Parameter(description = "크롤러 계정당 대상 계정 수 (1~100)", example = "5")
        @RequestParam(required = false) Integer maxTargets,
        @Parameter(description = "이미 크롤링한 대상도 다시 수집", example = "false")
        @RequestParam(defaultValue = "false") boolean recrawl) {
        CrawlMode crawlMode;
        try {
            crawlMode = CrawlMode.valueOf(mode.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("모드는 light, heavy, both 중 하나여야 합니다.");
        }
        if (maxVideos != null && (maxVideos <= 0 || maxVideos > 200)) {
            return ResponseEntity.badRequest().body("동영상 수는 1에서 200 사이여야 합니다.");
        }
        if (maxTargets != null && (maxTargets <= 0 || maxTargets > 100)) {
            return ResponseEntity.badRequest().body("대상 계정 수는 1에서 100 사이여야 합니다.");
        }

        CrawlRunRequest request = CrawlRunRequest.builder()
                .mode(crawlMode)
                .identityId(identityId)
                .maxVideosPerTarget(maxVideos)
                .maxTargets(maxTargets)
                .recrawl(recrawl)
                .build();
        // 비동기로 실행 (별도 스레드에서 작업 수행)
        new Thread(() -> crawlScheduler.run(request)).start();
        return ResponseEntity.ok(crawlMode + " 모드 크롤링을 시작했습니다. 진행 상황은 /status 에서 확인할 수 있습니다.");
    }

    /**
     * 작업 현황 조회 API
     * 
     * @return 항목별 개수를 담은 Map
     */
    @Operation(summary = "2. 작업 현황 조회",
               description = "활성 크롤러 계정/대상 계정 수, 저장된 Heavy/Light 레코드 수, 진행 중/완료/중단된 세션 수를 조회합니다.")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Long>> getStatus() {
        return ResponseEntity.ok(crawlStatusService.getStatus());
    }
}
