package com.example.gatekeeper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Redis のハッシュに状態を置くストア。
 *
 *   gatekeeper:state:{clientKey} -> { tokens, lastRefillAt, dayCount, dayKey }
 *
 * 値はすべて10進文字列。dayKey が null のときはフィールドごと消す。
 * 保存のたびに TTL を延長するので、しばらく来ないキーは勝手に消える
 * （消えても次回は初期状態から始まるだけ）。
 *
 * 同じキーへの読み書きは RateDecisionActor が直列化しているので、ここでは Lua を使わない。
 */
@Service
@ConditionalOnProperty(prefix = "gatekeeper", name = "backend", havingValue = "redis")
public class RedisRateLimitStateStore implements RateLimitStateStore {

    static final String KEY_PREFIX = "gatekeeper:state:";
    static final String TOKENS = "tokens";
    static final String LAST_REFILL_AT = "lastRefillAt";
    static final String DAY_COUNT = "dayCount";
    static final String DAY_KEY = "dayKey";

    private final StringRedisTemplate redis;
    private final RateLimitProperties props;

    public RedisRateLimitStateStore(StringRedisTemplate redisTemplate, RateLimitProperties props) {
        this.redis = redisTemplate;
        this.props = props;
    }

    @Override
    public Optional<RateLimitState> load(String clientKey) {
        final String key = KEY_PREFIX + clientKey;
        try {
            Map<String, String> fields = hashOps().entries(key);
            if (fields == null || fields.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new RateLimitState(
                    Integer.parseInt(require(fields, TOKENS, key)),
                    Long.parseLong(require(fields, LAST_REFILL_AT, key)),
                    Integer.parseInt(require(fields, DAY_COUNT, key)),
                    fields.get(DAY_KEY)
            ));
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to load rate limit state for " + key, e);
        } catch (NumberFormatException e) {
            throw new StateStoreException("Corrupt rate limit state at " + key, e);
        }
    }

    @Override
    public void save(String clientKey, RateLimitState state) {
        final String key = KEY_PREFIX + clientKey;
        Map<String, String> fields = new HashMap<>();
        fields.put(TOKENS, String.valueOf(state.tokens()));
        fields.put(LAST_REFILL_AT, String.valueOf(state.lastRefillAt()));
        fields.put(DAY_COUNT, String.valueOf(state.dayCount()));
        if (state.dayKey() != null) {
            fields.put(DAY_KEY, state.dayKey());
        }
        try {
            hashOps().putAll(key, fields);
            if (state.dayKey() == null) {
                hashOps().delete(key, DAY_KEY);
            }
            redis.expire(key, props.getStateTtl());
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to save rate limit state for " + key, e);
        }
    }

    private HashOperations<String, String, String> hashOps() {
        return redis.opsForHash();
    }

    private static String require(Map<String, String> fields, String field, String key) {
        String value = fields.get(field);
        if (value == null) {
            throw new NumberFormatException("missing field " + field + " in " + key);
        }
        return value;
    }
}
