package com.example.gatekeeper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * キーごとに RateDecisionActor を1つ割り当てるレートリミッター。
 * アクターはアプリ内メモリ (ConcurrentHashMap) に置き、状態そのものは RateLimitStateStore に置く。
 *
 * しばらく使われないアクターは掃除する。状態はストアに残っているので、
 * 次に来たときに新しいアクターが読み直すだけ。
 */
@Service
public class ActorRateLimiterService implements RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(ActorRateLimiterService.class);

    private final RateLimitProperties props;
    private final RateLimitStateStore store;
    private final CalendarWindow calendar;
    private final TokenBucket bucket;
    private final Clock clock;

    private final Counter allowedCounter;
    private final Counter deniedDailyCounter;
    private final Counter deniedBurstCounter;
    private final Counter unavailableCounter;

    private final Map<String, RateDecisionActor> actors = new ConcurrentHashMap<>();

    public ActorRateLimiterService(
            RateLimitProperties props,
            RateLimitStateStore store,
            CalendarWindow calendar,
            Clock clock,
            MeterRegistry registry
    ) {
        this.props = props;
        this.store = store;
        this.calendar = calendar;
        this.bucket = new TokenBucket(props.getRatePerSecond(), props.getCapacity());
        this.clock = clock;
        this.allowedCounter = outcomeCounter(registry, "allowed");
        this.deniedDailyCounter = outcomeCounter(registry, "denied_daily");
        this.deniedBurstCounter = outcomeCounter(registry, "denied_burst");
        this.unavailableCounter = outcomeCounter(registry, "unavailable");
    }

    @Override
    public RateDecision evaluate(String clientKey) {
        RateDecision decision;
        try {
            decision = evaluateWithLiveActor(clientKey);
        } catch (ActorUnavailableException e) {
            unavailableCounter.increment();
            throw e;
        }

        switch (decision.denial()) {
            case NONE -> allowedCounter.increment();
            case DAILY -> deniedDailyCounter.increment();
            case BURST -> deniedBurstCounter.increment();
        }

        evictIfIdle(clock.millis());
        return decision;
    }

    int actorCount() {
        return actors.size();
    }

    private RateDecision evaluateWithLiveActor(String clientKey) {
        while (true) {
            RateDecisionActor actor = actors.computeIfAbsent(clientKey, this::newActor);
            Optional<RateDecision> decision = actor.evaluate();
            if (decision.isPresent()) {
                return decision.get();
            }
            // 掃除と入れ違いになった。引退済みを外して引き直す
            actors.remove(clientKey, actor);
        }
    }

    private RateDecisionActor newActor(String clientKey) {
        return new RateDecisionActor(
                clientKey,
                store,
                calendar,
                bucket,
                props.getDayLimit(),
                props.getActorTimeout(),
                clock
        );
    }

    private void evictIfIdle(long now) {
        long idleSec = props.getIdleEvictSeconds();
        if (idleSec <= 0) return;

        long cutoff = now - idleSec * 1000L;

        for (Map.Entry<String, RateDecisionActor> e : actors.entrySet()) {
            RateDecisionActor actor = e.getValue();
            if (actor.lastAccessMillis() < cutoff && actor.retireIfIdle(cutoff)) {
                actors.remove(e.getKey(), actor);
                log.debug("Evicted idle rate limiter for key={}", e.getKey());
            }
        }
    }

    private static Counter outcomeCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("gatekeeper_decisions_total")
                .tag("outcome", outcome)
                .register(registry);
    }
}
