package com.example.videostatcrawling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 동영상 인기 지표 크롤링 시스템의 메인 애플리케이션 클래스
 * 
 * 기본적으로 REST API 서버로 동작하며,
 * crawler.run-on-startup=true 로 실행하면 크롤링 1회 후 종료 코드와 함께 종료합니다.
 */
@SpringBootApplication
public class VideostatcrawlingApplication {

	/**
	 * 애플리케이션 실행 진입점
	 * 
	 * @param args 커맨드 라인 인자 (예: --crawler.run-on-startup=true --crawler.startup.mode=heavy)
	 */
	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(VideostatcrawlingApplication.class, args);
		if (context.getEnvironment().getProperty("crawler.run-on-startup", Boolean.class, false)) {
			System.exit(SpringApplication.exit(context));
		}
	}
}
