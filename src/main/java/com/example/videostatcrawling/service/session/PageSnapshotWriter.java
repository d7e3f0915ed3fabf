package com.example.videostatcrawling.service.session;

import com.example.videostatcrawling.config.CrawlerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 세션 중단 시점의 페이지 소스를 진단용 HTML 파일로 저장
 * 
 * 저장 경로: {snapshot-dir}/{대상 사용자명}/{yyyyMMdd-HHmmss}-{사유}.html
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageSnapshotWriter {

    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final CrawlerProperties properties;

    /**
     * @return 저장한 파일 (저장하지 않았거나 실패하면 null)
     */
    public File write(String targetUsername, AbortReason reason, LocalDateTime capturedAt, String pageSource) {
        if (!StringUtils.hasText(properties.getSnapshotDir()) || pageSource == null) {
            return null;
        }
        File targetDir = new File(properties.getSnapshotDir(), targetUsername);
        File file = new File(targetDir, capturedAt.format(FILE_TIME) + "-" + reason.name().toLowerCase() + ".html");
        try {
            FileUtils.writeStringToFile(file, pageSource, StandardCharsets.UTF_8);
            log.info("[스냅샷] 페이지 소스 저장 완료: {}", file.getAbsolutePath());
            return file;
        } catch (IOException e) {
            log.warn("[스냅샷] 페이지 소스 저장 실패: {} ({})", file.getAbsolutePath(), e.getMessage());
            return null;
        }
    }
}
