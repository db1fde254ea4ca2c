package com.example.gatekeeper;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * すべてのリクエストの入口。
 *
 *  1. 信頼済みヘッダからクライアントを特定（無ければ 400）
 *  2. レートリミッターに判定させる（判定できなければ 502、転送しない）
 *  3. 拒否 → 429 + Retry-After
 *  4. 許可 → オリジンへ転送し、応答に残量ヘッダを付けて返す
 *
 * 例外から HTTP ステータスへの変換は GatewayExceptionHandler。
 */
@RestController
public class GatewayHandler {

    static final String REMAINING_DAY = "X-RateLimit-Remaining-Day";
    static final String RESET_DAY = "X-RateLimit-Reset-Day";

    private static final Logger log = LoggerFactory.getLogger(GatewayHandler.class);

    private final RateLimiterService rateLimiter;
    private final OriginClient originClient;
    private final RateLimitProperties props;

    public GatewayHandler(RateLimiterService rateLimiter, OriginClient originClient, RateLimitProperties props) {
        this.rateLimiter = rateLimiter;
        this.originClient = originClient;
        this.props = props;
    }

    /**
     * 使い方:
     *  curl -i -H "CF-Connecting-IP: 203.0.113.7" http://localhost:8080/api/chat
     *
     * レスポンス:
     *  - オリジンの応答      → allowed=true（X-RateLimit-* 付き）
     *  - 429 Too Many ...    → allowed=false + Retry-After
     */
    @RequestMapping("/**")
    public ResponseEntity<byte[]> handle(HttpServletRequest request,
                                         @RequestHeader HttpHeaders headers,
                                         @RequestBody(required = false) byte[] body) {
        String clientKey = resolveClientKey(headers);

        RateDecision decision = rateLimiter.evaluate(clientKey);

        if (!decision.allowed()) {
            log.warn("rate_limit_exceeded client={} method={} path={} denial={} dailyRemaining={} retryAfterMs={}",
                    clientKey, request.getMethod(), request.getRequestURI(),
                    decision.denial(), decision.dailyRemaining(), decision.retryAfterMillis());

            HttpHeaders out = quotaHeaders(decision);
            out.set(HttpHeaders.RETRY_AFTER, String.valueOf(ceilSeconds(decision.retryAfterMillis())));
            out.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
            return new ResponseEntity<>("Rate limit exceeded".getBytes(StandardCharsets.UTF_8), out, HttpStatus.TOO_MANY_REQUESTS);
        }

        ResponseEntity<byte[]> upstream = originClient.forward(request.getMethod(), pathAndQuery(request), headers, body);

        HttpHeaders out = new HttpHeaders();
        out.addAll(upstream.getHeaders());
        out.putAll(quotaHeaders(decision));
        return new ResponseEntity<>(upstream.getBody(), out, upstream.getStatusCode());
    }

    private String resolveClientKey(HttpHeaders headers) {
        String headerName = props.getClientIdentityHeader();
        String value = headers.getFirst(headerName);
        if (value == null || value.isBlank()) {
            throw new MissingClientIdentityException(headerName);
        }
        return value.trim();
    }

    private static HttpHeaders quotaHeaders(RateDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(REMAINING_DAY, String.valueOf(decision.dailyRemaining()));
        headers.set(RESET_DAY, String.valueOf(decision.dailyResetInMillis() / 1000L));
        return headers;
    }

    private static String pathAndQuery(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    static long ceilSeconds(long millis) {
        return (millis + 999L) / 1000L;
    }
}
