package com.example.gatekeeper;

/**
 * 転送先オリジンが設定されていない。
 */
public class OriginMisconfiguredException extends GatekeeperException {

    public OriginMisconfiguredException(String message) {
        super("ORIGIN_MISCONFIGURED", message);
    }
}
