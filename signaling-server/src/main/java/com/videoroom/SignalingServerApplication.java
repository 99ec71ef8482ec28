package com.videoroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot 진입점. 화상 회의 시그널링 서버 전체를 실행한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SignalingServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalingServerApplication.class, args);
    }
}
