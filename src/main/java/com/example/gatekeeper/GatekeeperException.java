package com.example.gatekeeper;

/**
 * ゲートキーパーの基底例外。errorCode はログとレスポンスの対応付けに使う。
 */
public class GatekeeperException extends RuntimeException {

    private final String errorCode;

    public GatekeeperException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GatekeeperException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
