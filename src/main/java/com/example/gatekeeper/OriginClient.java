package com.example.gatekeeper;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * 許可されたリクエストをオリジンへそのまま転送し、応答をそのまま持ち帰る。
 * メソッド・ヘッダ・ボディは変えない（ホップ間ヘッダと Host だけ落とす）。
 * オリジンの 4xx/5xx は例外にせず ResponseEntity として返す。
 */
@Component
public class OriginClient {

    // RFC 9110 7.6.1 のホップ間ヘッダ + 転送先で付け直すもの
    private static final Set<String> NOT_FORWARDED = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade", "host", "content-length", "expect");

    private final RestClient restClient;
    private final RateLimitProperties props;

    public OriginClient(RestClient.Builder restClientBuilder, RateLimitProperties props) {
        this.restClient = restClientBuilder.build();
        this.props = props;
    }

    /**
     * @param method       受けたリクエストのメソッド
     * @param pathAndQuery 生のパス + クエリ（例: "/api/chat?x=1"）
     * @param headers      受けたリクエストのヘッダ
     * @param body         受けたボディ（無ければ null）
     * @throws OriginMisconfiguredException 転送先が未設定・不正
     * @throws OriginUnreachableException   オリジンに届かなかった
     */
    public ResponseEntity<byte[]> forward(String method, String pathAndQuery, HttpHeaders headers, byte[] body) {
        URI target = resolveTarget(pathAndQuery);

        RestClient.RequestBodySpec request = restClient
                .method(HttpMethod.valueOf(method))
                .uri(target)
                .headers(h -> copyHeaders(headers, h));
        if (body != null && body.length > 0) {
            request.body(body);
        }

        try {
            return request.exchange((req, res) -> {
                HttpHeaders relayed = new HttpHeaders();
                copyHeaders(res.getHeaders(), relayed);
                byte[] bytes = StreamUtils.copyToByteArray(res.getBody());
                return ResponseEntity.status(res.getStatusCode()).headers(relayed).body(bytes);
            });
        } catch (ResourceAccessException e) {
            throw new OriginUnreachableException("Origin " + target + " unreachable", e);
        }
    }

    /**
     * 設定されたオリジンのスキーム・ホスト・ポートはそのままに、パスとクエリだけ差し替える。
     * "//host/..." のようなパスでも転送先のホストは変わらない。
     */
    URI resolveTarget(String pathAndQuery) {
        URI base = originBase();

        int q = pathAndQuery.indexOf('?');
        String path = q < 0 ? pathAndQuery : pathAndQuery.substring(0, q);
        String query = q < 0 ? null : pathAndQuery.substring(q + 1);

        // 受けた URI はエンコード済みなので二重にエンコードしない
        return UriComponentsBuilder.fromUri(base)
                .replacePath(path)
                .replaceQuery(query)
                .fragment(null)
                .build(true)
                .toUri();
    }

    private URI originBase() {
        String origin = props.getOrigin();
        if (origin == null || origin.isBlank()) {
            throw new OriginMisconfiguredException("Backend origin not configured");
        }
        try {
            URI base = URI.create(origin.trim());
            if (base.getScheme() == null || base.getHost() == null) {
                throw new OriginMisconfiguredException("Backend origin is not an absolute URL: " + origin);
            }
            return base;
        } catch (IllegalArgumentException e) {
            throw new OriginMisconfiguredException("Backend origin is not a valid URL: " + origin);
        }
    }

    private static void copyHeaders(HttpHeaders from, HttpHeaders to) {
        from.forEach((name, values) -> {
            if (!NOT_FORWARDED.contains(name.toLowerCase(Locale.ROOT))) {
                to.addAll(name, values);
            }
        });
    }
}
