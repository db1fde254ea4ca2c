package com.example.gatekeeper;

/**
 * 状態ストアの読み書きに失敗した。
 */
public class StateStoreException extends GatekeeperException {

    public StateStoreException(String message, Throwable cause) {
        super("STATE_STORE", message, cause);
    }
}
