package com.example.gatekeeper;

/**
 * 1回の評価結果。
 * denial は拒否理由（許可時は NONE）。レスポンス上はどちらの拒否も 429 で区別しない。
 */
public record RateDecision(boolean allowed, long retryAfterMillis, int dailyRemaining, long dailyResetInMillis, Denial denial) {

    static RateDecision allow(int dailyRemaining, long dailyResetInMillis) {
        return new RateDecision(true, 0L, dailyRemaining, dailyResetInMillis, Denial.NONE);
    }

    static RateDecision deny(Denial denial, long retryAfterMillis, int dailyRemaining, long dailyResetInMillis) {
        return new RateDecision(false, Math.max(0L, retryAfterMillis), dailyRemaining, dailyResetInMillis, denial);
    }
}
