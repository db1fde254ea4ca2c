package com.example.gatekeeper;

public interface RateLimiterService {

    /**
     * クライアントキー1件ぶんのリクエストを今の時刻で判定する。
     *
     * @throws ActorUnavailableException 判定できなかった（呼び出し側は拒否として扱うこと）
     */
    RateDecision evaluate(String clientKey);
}
