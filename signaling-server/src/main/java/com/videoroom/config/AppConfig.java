package com.videoroom.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 공용 Bean 정의를 담고 있는 설정 클래스.
 */
@Configuration
public class AppConfig {

	/**
	 * SFU REST 호출에 사용할 RestTemplate을 생성한다.
	 * 타임아웃은 media-engine 설정에서 읽는다.
	 */
	@Bean
	public RestTemplate restTemplate(MediaEngineProperties properties) {
		RequestConfig rc = RequestConfig.custom()
			.setConnectTimeout(Timeout.ofMilliseconds(properties.getConnectTimeout().toMillis()))
			.setResponseTimeout(Timeout.ofMilliseconds(properties.getResponseTimeout().toMillis()))
			.setExpectContinueEnabled(false)
			.build();

		CloseableHttpClient httpClient = HttpClients.custom()
			// 명령을 재시도하면 SFU 쪽 참가자 상태가 꼬이므로 자동 재시도를 끈다.
			.setDefaultRequestConfig(rc)
			.disableAutomaticRetries()
			.build();

		var rf = new HttpComponentsClientHttpRequestFactory(httpClient);
		return new RestTemplate(rf);
	}

	/**
	 * 방 코디네이터와 참가자 엔드포인트의 mailbox가 공유하는 스레드 풀.
	 */
	@Bean(destroyMethod = "shutdown")
	public ExecutorService actorExecutor(SignalingProperties properties) {
		return Executors.newFixedThreadPool(properties.getActorThreads(), new CustomizableThreadFactory("actor-"));
	}

	/**
	 * 시작/종료 대기 시간 제한에 쓰는 스케줄러.
	 */
	@Bean(destroyMethod = "shutdownNow")
	public ScheduledExecutorService actorScheduler() {
		return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("actor-timer-"));
	}
}
