package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.constants.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * GET {base}/v1/live-data/quote?exchange=NSE&segment=CASH&trading_symbol=RELIANCE
 */
@Component
public class HttpUpstreamTransport implements UpstreamTransport {

    private static final String QUOTE_PATH = "/v1/live-data/quote";

    private final HttpClient http;
    private final UpstreamProperties props;

    public HttpUpstreamTransport(UpstreamProperties props) {
        this.props = props;
        this.http = HttpClient.newBuilder()
                .connectTimeout(props.getRequestTimeout())
                .build();
    }

    @Override
    public UpstreamResponse execute(UpstreamRequest request, String bearerToken) throws IOException, InterruptedException {
        String url = props.getBaseUrl() + QUOTE_PATH
                + "?exchange=" + enc(request.exchange())
                + "&segment=" + enc(request.segment())
                + "&trading_symbol=" + enc(request.symbol());

        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(props.getRequestTimeout())
                .header("Accept", "application/json")
                .header("X-API-VERSION", "1.0")
                .header("Authorization", "Bearer " + bearerToken)
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        return new UpstreamResponse(resp.statusCode(), resp.body());
    }

    private static String enc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
