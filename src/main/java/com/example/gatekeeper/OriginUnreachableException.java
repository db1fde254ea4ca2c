package com.example.gatekeeper;

/**
 * 許可済みリクエストの転送中に I/O エラーでオリジンから応答が取れなかった。
 * オリジンが返した 4xx/5xx はこれにならず、そのまま中継する。
 */
public class OriginUnreachableException extends GatekeeperException {

    public OriginUnreachableException(String message, Throwable cause) {
        super("ORIGIN_UNREACHABLE", message, cause);
    }
}
