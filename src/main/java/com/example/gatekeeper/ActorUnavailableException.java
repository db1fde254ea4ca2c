package com.example.gatekeeper;

/**
 * レート判定ができなかった（状態ストア障害、ロック待ちのタイムアウト）。
 * 呼び出し側はこれを拒否として扱い、オリジンには絶対に転送しない。
 */
public class ActorUnavailableException extends GatekeeperException {

    public ActorUnavailableException(String message) {
        super("ACTOR_UNAVAILABLE", message);
    }

    public ActorUnavailableException(String message, Throwable cause) {
        super("ACTOR_UNAVAILABLE", message, cause);
    }
}
