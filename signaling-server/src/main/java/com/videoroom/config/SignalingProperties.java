package com.videoroom.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml의 signaling 설정 값을 바인딩하기 위한 POJO.
 */
@Validated
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    /**
     * 접속 토픽에서 방 ID 앞에 붙는 고정 접두어.
     */
    @NotBlank
    private String roomTopicPrefix = "room:";

    private String websocketPath = "/ws";

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    private Duration startTimeout = Duration.ofSeconds(5);

    private Duration shutdownTimeout = Duration.ofSeconds(5);

    @Min(1)
    private int actorThreads = Math.max(4, Runtime.getRuntime().availableProcessors());

    private Engine engine = new Engine();

    public String getRoomTopicPrefix() {
        return roomTopicPrefix;
    }

    public void setRoomTopicPrefix(String roomTopicPrefix) {
        this.roomTopicPrefix = roomTopicPrefix;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public void setWebsocketPath(String websocketPath) {
        this.websocketPath = websocketPath;
    }

    public List<String> getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns == null ? new ArrayList<>() : allowedOriginPatterns;
    }

    public Duration getStartTimeout() {
        return startTimeout;
    }

    public void setStartTimeout(Duration startTimeout) {
        this.startTimeout = startTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getActorThreads() {
        return actorThreads;
    }

    public void setActorThreads(int actorThreads) {
        this.actorThreads = actorThreads;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    /**
     * 사용할 미디어 엔진 바인딩. rest는 외부 SFU 서버, loopback은 프로세스 내부 엔진이다.
     */
    public static class Engine {
        private String type = "rest";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
