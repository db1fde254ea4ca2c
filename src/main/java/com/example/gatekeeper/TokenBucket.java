package com.example.gatekeeper;

/**
 * 整数トークンのトークンバケット（補充と消費のアルゴリズムだけ）。
 * ratePerSecond: 1秒あたり補充するトークン数
 * capacity: バースト容量
 *
 * 状態は持たない。RateLimitState と現在時刻を引数でもらう純粋な計算なので、
 * 時計を止めたままテストできる。
 */
final class TokenBucket {
    private final int ratePerSecond;
    private final int capacity;

    TokenBucket(int ratePerSecond, int capacity) {
        if (ratePerSecond <= 0) throw new IllegalArgumentException("ratePerSecond <= 0");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
    }

    int capacity() { return capacity; }

    /**
     * 経過時間ぶんのトークンを補充する。
     * lastRefillAt は「実際に足したトークンぶんの時間」だけ進める。
     * 端数の経過時間は捨てずに次回へ持ち越す。
     */
    void refill(RateLimitState state, long nowMillis) {
        long elapsed = nowMillis - state.lastRefillAt();
        if (elapsed <= 0) return; // 時計が戻った or 経過なし

        long toAdd = (long) Math.floor(elapsed / 1000.0 * ratePerSecond);
        if (toAdd <= 0) return;

        state.setTokens((int) Math.min(capacity, state.tokens() + toAdd));
        state.setLastRefillAt(state.lastRefillAt() + (long) Math.floor((double) toAdd / ratePerSecond * 1000.0));
    }

    /** 1トークン消費を試みる。 */
    boolean consume(RateLimitState state) {
        if (state.tokens() > 0) {
            state.setTokens(state.tokens() - 1);
            return true;
        }
        return false;
    }

    /** 次の1トークンまでの最短待ち時間の目安（正確な起床時刻ではない） */
    long retryAfterMillis() {
        return (long) Math.ceil(1000.0 / ratePerSecond);
    }
}
