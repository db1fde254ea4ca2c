package com.example.gatekeeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 1クライアントキーの状態の唯一の持ち主。
 *
 * 同じキーへの評価は ReentrantLock で1本に直列化する。読み込み→判定→保存が
 * ひとかたまりで走るので、トークン1枚を2つのリクエストが同時に取ることはない。
 * 別のキーはそれぞれ別のアクターなので互いに待たない。
 *
 * 判定の順番（日次上限がバースト制限より優先）:
 *  1. 状態を読む（なければ初期状態）
 *  2. 暦日が変わっていたら dayCount を 0 に戻す
 *  3. 日次上限に達していたら翌日 0:00 まで拒否
 *  4. トークンを補充
 *  5. トークンが無ければ 1トークン分待てと拒否
 *  6. トークンを1枚使い、dayCount を増やして許可
 *
 * 状態が変わった評価はすべて保存する（拒否時の日付リセットや補充も含む）。
 *
 * 現在時刻はロックを取ってから読む。ロック待ちの間に日付が変わっても、
 * 先に終わった評価より古い時刻で判定することはない。
 */
final class RateDecisionActor {

    private static final Logger log = LoggerFactory.getLogger(RateDecisionActor.class);

    private final String clientKey;
    private final RateLimitStateStore store;
    private final CalendarWindow calendar;
    private final TokenBucket bucket;
    private final int dayLimit;
    private final Duration lockTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile long lastAccessMillis;

    // lock を持っているときだけ読み書きする
    private boolean retired;

    RateDecisionActor(String clientKey,
                      RateLimitStateStore store,
                      CalendarWindow calendar,
                      TokenBucket bucket,
                      int dayLimit,
                      Duration lockTimeout,
                      Clock clock) {
        this.clientKey = clientKey;
        this.store = store;
        this.calendar = calendar;
        this.bucket = bucket;
        this.dayLimit = dayLimit;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
        this.lastAccessMillis = clock.millis();
    }

    String clientKey() { return clientKey; }

    long lastAccessMillis() { return lastAccessMillis; }

    /**
     * 1リクエスト分を判定する。
     *
     * @return 判定結果。掃除で引退済みのアクターだった場合は empty（呼び出し側で引き直す）
     * @throws ActorUnavailableException ロック待ちのタイムアウト、または状態ストアの障害
     */
    Optional<RateDecision> evaluate() {
        acquire();
        try {
            if (retired) {
                return Optional.empty();
            }
            long nowMillis = clock.millis();
            lastAccessMillis = Math.max(lastAccessMillis, nowMillis);
            return Optional.of(decide(nowMillis));
        } catch (StateStoreException e) {
            throw new ActorUnavailableException("Rate limit state unavailable for " + clientKey, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * cutoff より前から使われていなければ引退させる。
     * 評価中（ロック保持中）のアクターには触らない。
     */
    boolean retireIfIdle(long cutoffMillis) {
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (!retired && lastAccessMillis < cutoffMillis) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    private RateDecision decide(long clockNow) {
        RateLimitState loaded = store.load(clientKey).orElse(null);
        // 時計が戻っても、保存済みの時刻より前の日付には戻さない
        long now = loaded != null ? Math.max(clockNow, loaded.lastRefillAt()) : clockNow;
        RateLimitState state = loaded != null ? loaded.copy() : RateLimitState.initial(bucket.capacity(), now);

        String currentDayKey = calendar.dayKey(now);
        if (!currentDayKey.equals(state.dayKey())) {
            state.setDayKey(currentDayKey);
            state.setDayCount(0);
        }

        int dailyRemaining = Math.max(0, dayLimit - state.dayCount());
        long dailyResetInMillis = calendar.msUntilNextMidnight(now);

        // 日次上限はトークンの有無に関係なく止める
        if (dailyRemaining == 0) {
            persistIfChanged(loaded, state);
            log.debug("key={} denied: daily limit reached (dayKey={})", clientKey, state.dayKey());
            return RateDecision.deny(Denial.DAILY, dailyResetInMillis, 0, dailyResetInMillis);
        }

        bucket.refill(state, now);

        if (!bucket.consume(state)) {
            persistIfChanged(loaded, state);
            log.debug("key={} denied: bucket empty", clientKey);
            return RateDecision.deny(Denial.BURST, bucket.retryAfterMillis(), dailyRemaining, dailyResetInMillis);
        }

        state.setDayCount(state.dayCount() + 1);
        store.save(clientKey, state);
        log.debug("key={} allowed: tokens={} dayCount={}", clientKey, state.tokens(), state.dayCount());
        return RateDecision.allow(Math.max(0, dayLimit - state.dayCount()), dailyResetInMillis);
    }

    private void persistIfChanged(RateLimitState loaded, RateLimitState state) {
        if (!state.equals(loaded)) {
            store.save(clientKey, state);
        }
    }

    private void acquire() {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ActorUnavailableException(
                        "Timed out after " + lockTimeout.toMillis() + "ms waiting for rate limiter of " + clientKey);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorUnavailableException("Interrupted waiting for rate limiter of " + clientKey, e);
        }
    }
}
