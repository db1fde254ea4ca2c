package com.example.gatekeeper;

import java.util.Objects;

/**
 * 1クライアントキー分の永続化される状態。
 *
 * tokens:       バケツに残っているトークン数 (0..capacity)
 * lastRefillAt: 最後に補充を計上した時刻 (epoch ms)。前にしか進まない。
 * dayCount:     今日許可したリクエスト数
 * dayKey:       今日を表す "YYYY-MM-DD"（基準タイムゾーン）。初回までは null。
 *
 * スレッドセーフではない。触ってよいのは、そのキーを持つ RateDecisionActor だけ。
 */
public final class RateLimitState {
    private int tokens;
    private long lastRefillAt;
    private int dayCount;
    private String dayKey;

    public RateLimitState(int tokens, long lastRefillAt, int dayCount, String dayKey) {
        this.tokens = tokens;
        this.lastRefillAt = lastRefillAt;
        this.dayCount = dayCount;
        this.dayKey = dayKey;
    }

    /** 初めて見るキー用: 満タン、日次カウント0、dayKey未設定 */
    static RateLimitState initial(int capacity, long nowMillis) {
        return new RateLimitState(capacity, nowMillis, 0, null);
    }

    public RateLimitState copy() {
        return new RateLimitState(tokens, lastRefillAt, dayCount, dayKey);
    }

    public int tokens() { return tokens; }
    void setTokens(int tokens) { this.tokens = tokens; }

    public long lastRefillAt() { return lastRefillAt; }
    void setLastRefillAt(long lastRefillAt) { this.lastRefillAt = lastRefillAt; }

    public int dayCount() { return dayCount; }
    void setDayCount(int dayCount) { this.dayCount = dayCount; }

    public String dayKey() { return dayKey; }
    void setDayKey(String dayKey) { this.dayKey = dayKey; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimitState other)) return false;
        return tokens == other.tokens
                && lastRefillAt == other.lastRefillAt
                && dayCount == other.dayCount
                && Objects.equals(dayKey, other.dayKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokens, lastRefillAt, dayCount, dayKey);
    }

    @Override
    public String toString() {
        return "RateLimitState{tokens=" + tokens
                + ", lastRefillAt=" + lastRefillAt
                + ", dayCount=" + dayCount
                + ", dayKey=" + dayKey + '}';
    }
}
