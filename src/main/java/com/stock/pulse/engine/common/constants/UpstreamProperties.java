package com.stock.pulse.engine.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "stockpulse.upstream")
public class UpstreamProperties {
    private String baseUrl = "https://api.groww.in";
    private String apiKey;
    private String totpSecret;
    private String exchange = "NSE";
    private String segment = "CASH";
    private String zone = "Asia/Kolkata";

    // request budget
    private int requestsPerSecond = 10;
    private int requestsPerMinute = 300;
    private Duration permitTimeout = Duration.ofSeconds(65);

    // retry
    private int maxAttempts = 5;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private Duration requestTimeout = Duration.ofSeconds(10);

    // session
    private Duration refreshDedupWindow = Duration.ofSeconds(5);
    private int refreshAttempts = 3;
    private Duration refreshBackoff = Duration.ofSeconds(1);
    private Duration tokenTtl = Duration.ofHours(8);
    private Duration expirySkew = Duration.ofSeconds(30);

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && totpSecret != null && !totpSecret.isBlank();
    }
}
