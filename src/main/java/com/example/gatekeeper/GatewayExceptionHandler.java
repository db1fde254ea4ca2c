package com.example.gatekeeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.nio.charset.StandardCharsets;

/**
 * ゲートキーパーの例外を、プレーンテキストの応答に変換する。
 * 判定できないときは閉じる側（502）に倒す。
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    @ExceptionHandler(MissingClientIdentityException.class)
    public ResponseEntity<String> handleMissingIdentity(MissingClientIdentityException e) {
        log.warn("[{}] {}", e.getErrorCode(), e.getMessage());
        return text(HttpStatus.BAD_REQUEST, "Could not determine client identity");
    }

    @ExceptionHandler(ActorUnavailableException.class)
    public ResponseEntity<String> handleActorUnavailable(ActorUnavailableException e) {
        log.warn("[{}] {}", e.getErrorCode(), e.getMessage(), e.getCause());
        return text(HttpStatus.BAD_GATEWAY, "Could not connect to rate limiter");
    }

    @ExceptionHandler(OriginMisconfiguredException.class)
    public ResponseEntity<String> handleOriginMisconfigured(OriginMisconfiguredException e) {
        log.error("[{}] {}", e.getErrorCode(), e.getMessage());
        return text(HttpStatus.INTERNAL_SERVER_ERROR, "Backend origin not configured");
    }

    @ExceptionHandler(OriginUnreachableException.class)
    public ResponseEntity<String> handleOriginUnreachable(OriginUnreachableException e) {
        log.warn("[{}] {}", e.getErrorCode(), e.getMessage(), e.getCause());
        return text(HttpStatus.BAD_GATEWAY, "Origin unreachable");
    }

    private static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(TEXT_PLAIN_UTF8).body(body);
    }
}
