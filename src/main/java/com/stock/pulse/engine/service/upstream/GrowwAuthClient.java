package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.RateLimitExceededException;
import com.stock.pulse.engine.common.exception.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Exchanges the long-lived API key plus a TOTP code for a short-lived bearer token.
 * <p>
 * POST {base}/v1/token/api/access
 * Authorization: Bearer {api-key}
 * Body: { "key_type": "totp", "totp": "123456" }
 */
@Slf4j
@Component
public class GrowwAuthClient {

    private static final String TOKEN_PATH = "/v1/token/api/access";

    private final HttpClient http = HttpClient.newHttpClient();
    private final ObjectMapper mapper;
    private final UpstreamProperties props;
    private final TotpCodeGenerator totp;
    private final Clock clock;

    public GrowwAuthClient(ObjectMapper mapper, UpstreamProperties props, TotpCodeGenerator totp, Clock clock) {
        this.mapper = mapper;
        this.props = props;
        this.totp = totp;
        this.clock = clock;
    }

    /**
     * @throws AuthenticationException    credentials missing or rejected (401/403)
     * @throws TransientNetworkException  network trouble, 5xx, 429 or an unreadable answer
     */
    public IssuedToken exchange() {
        if (!props.hasCredentials()) {
            throw new AuthenticationException(AuthenticationException.NOT_CONFIGURED,
                    "Upstream API key or TOTP secret is not configured", null);
        }
        try {
            String body = mapper.writeValueAsString(Map.of(
                    "key_type", "totp",
                    "totp", totp.currentCode(props.getTotpSecret())));

            HttpRequest req = HttpRequest.newBuilder(URI.create(props.getBaseUrl() + TOKEN_PATH))
                    .timeout(props.getRequestTimeout())
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + props.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            if (sc == 401 || sc == 403) {
                throw new AuthenticationException("Token exchange rejected: HTTP " + sc);
            }
            if (sc == 429) throw new RateLimitExceededException("Token exchange throttled");
            if (sc / 100 != 2) throw new TransientNetworkException(sc, "Token exchange failed: HTTP " + sc);

            return parse(sc, resp.body());
        } catch (IOException e) {
            throw new TransientNetworkException(0, "Token exchange I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted during token exchange", e);
        }
    }

    IssuedToken parse(int status, String body) throws IOException {
        JsonNode root = mapper.readTree(body == null ? "" : body);
        if (root == null || !root.isObject()) {
            throw new TransientNetworkException(status, "Token exchange returned a non-object body");
        }
        JsonNode p = root.has("payload") && root.get("payload").isObject() ? root.get("payload") : root;
        String token = firstText(p, "token", "access_token");
        if (token == null) throw new TransientNetworkException(status, "Token exchange response carried no token");
        return new IssuedToken(token, parseExpiry(p.get("expiry")));
    }

    private Instant parseExpiry(JsonNode node) {
        Instant fallback = clock.instant().plus(props.getTokenTtl());
        if (node == null || node.isNull()) return fallback;
        if (node.isNumber()) {
            long v = node.asLong();
            return v > 100_000_000_000L ? Instant.ofEpochMilli(v) : Instant.ofEpochSecond(v);
        }
        String s = node.asText();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException notInstant) {
            try {
                return LocalDateTime.parse(s).atZone(ZoneId.of(props.getZone())).toInstant();
            } catch (DateTimeParseException e) {
                log.warn("Unreadable token expiry '{}', using configured ttl {}", s, props.getTokenTtl());
                return fallback;
            }
        }
    }

    private static String firstText(JsonNode node, String... names) {
        for (String n : names) {
            JsonNode v = node.get(n);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }
}
