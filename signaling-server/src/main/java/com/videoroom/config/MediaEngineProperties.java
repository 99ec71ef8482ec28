package com.videoroom.config;

import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml의 media-engine 설정 값을 바인딩하기 위한 POJO.
 */
@ConfigurationProperties(prefix = "media-engine")
public class MediaEngineProperties {

    private URI sfuServerUrl = URI.create("http://localhost:3001");
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration responseTimeout = Duration.ofSeconds(5);

    public URI getSfuServerUrl() {
        return sfuServerUrl;
    }

    public void setSfuServerUrl(URI sfuServerUrl) {
        this.sfuServerUrl = sfuServerUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    /**
     * 후행 슬래시를 제거한 SFU 서버 URI를 반환한다.
     */
    public URI getBaseUri() {
        if (sfuServerUrl == null) {
            throw new IllegalStateException("media-engine.sfu-server-url must be configured");
        }
        String base = sfuServerUrl.toString();
        if (base.endsWith("/")) {
            return URI.create(base.substring(0, base.length() - 1));
        }
        return sfuServerUrl;
    }
}
