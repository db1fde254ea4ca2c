package com.example.gatekeeper;

import java.util.Optional;

/**
 * クライアントキーごとの RateLimitState の保存先。
 *
 * 実装は2つ:
 *  - InMemoryRateLimitStateStore (backend=memory, デフォルト)
 *  - RedisRateLimitStateStore    (backend=redis)
 *
 * どちらも読み書きに失敗したら StateStoreException を投げる。リトライはしない。
 */
public interface RateLimitStateStore {

    Optional<RateLimitState> load(String clientKey);

    void save(String clientKey, RateLimitState state);
}
