package com.example.videostatcrawling.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger (SpringDoc OpenAPI) 설정 클래스
 * 
 * 접속 URL: http://localhost:8080/swagger-ui.html
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .components(new Components())
                .info(apiInfo());
    }

    private Info apiInfo() {
        return new Info()
                .title("Video Stat Crawling API")
                .description("숏폼 동영상 재생 수/좋아요 수 시계열 수집 크롤러의 API 명세서입니다. 크롤러 계정별로 게시자 페이지 → 동영상 페이지 → 크리에이터 피드 순서로 탐색합니다.")
                .version("1.0.0");
    }
}
