package com.videoroom.global.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SFU 서버가 호출하는 내부 API의 접근 제어 설정. 토큰과 허용 IP가 모두 비어 있으면 검사를 생략한다.
 */
@ConfigurationProperties(prefix = "internal-api")
public class InternalApiProperties {

    private String token;
    private List<String> allowedIps = new ArrayList<>();

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public List<String> getAllowedIps() {
        return allowedIps;
    }

    /**
     * 환경 변수에서 "a,b" 형태로 넘어와도 항목별로 나눠 저장한다.
     */
    public void setAllowedIps(List<String> allowedIps) {
        List<String> entries = new ArrayList<>();
        if (allowedIps != null) {
            allowedIps.stream()
                    .filter(Objects::nonNull)
                    .flatMap(entry -> Arrays.stream(entry.split(",")))
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .forEach(entries::add);
        }
        this.allowedIps = entries;
    }

    public boolean isAuthDisabled() {
        return !hasToken() && allowedIps.isEmpty();
    }

    public boolean isTokenValid(String providedToken) {
        return !hasToken() || token.equals(providedToken);
    }

    public boolean isIpAllowed(String clientIp) {
        if (allowedIps.isEmpty()) {
            return true;
        }
        if (clientIp == null || clientIp.isBlank()) {
            return false;
        }
        return allowedIps.stream()
                .anyMatch(allowed -> allowed.equals(clientIp) || (allowed.contains("/") && inRange(clientIp, allowed)));
    }

    private boolean hasToken() {
        return token != null && !token.isBlank();
    }

    private boolean inRange(String clientIp, String cidr) {
        String[] parts = cidr.split("/", 2);
        try {
            byte[] address = InetAddress.getByName(clientIp).getAddress();
            byte[] network = InetAddress.getByName(parts[0]).getAddress();
            int prefix = Integer.parseInt(parts[1]);
            if (address.length != network.length || prefix < 0 || prefix > address.length * 8) {
                return false;
            }
            for (int bit = 0; bit < prefix; bit++) {
                int mask = 0x80 >>> (bit % 8);
                if ((address[bit / 8] & mask) != (network[bit / 8] & mask)) {
                    return false;
                }
            }
            return true;
        } catch (UnknownHostException | NumberFormatException ex) {
            return false;
        }
    }
}
