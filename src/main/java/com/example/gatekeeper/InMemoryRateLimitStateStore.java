package com.example.gatekeeper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 単一インスタンス用の状態ストア。
 * アプリ内メモリ (ConcurrentHashMap) にコピーを保持する。再起動で消える。
 *
 * backend=memory のときだけ有効になる。
 */
@Service
@ConditionalOnProperty(prefix = "gatekeeper", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStateStore implements RateLimitStateStore {

    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitState> load(String clientKey) {
        RateLimitState stored = states.get(clientKey);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public void save(String clientKey, RateLimitState state) {
        states.put(clientKey, state.copy());
    }
}
