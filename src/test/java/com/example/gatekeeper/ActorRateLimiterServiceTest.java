package com.example.gatekeeper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActorRateLimiterServiceTest {

    private static final long T0 = Instant.parse("2025-02-12T15:00:00Z").toEpochMilli();

    private final CalendarWindow calendar = new CalendarWindow(ZoneId.of("America/New_York"));
    private final MutableClock clock = new MutableClock(T0);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void concurrentRequestsForLastToken_onlyOneIsAdmitted() throws Exception {
        // load に時間をかけて、2本目が必ず1本目の読み書きの最中に到着するようにする
        AtomicInteger concurrentLoads = new AtomicInteger();
        AtomicInteger maxConcurrentLoads = new AtomicInteger();
        InMemoryRateLimitStateStore store = new InMemoryRateLimitStateStore() {
            @Override
            public Optional<RateLimitState> load(String clientKey) {
                int inFlight = concurrentLoads.incrementAndGet();
                maxConcurrentLoads.accumulateAndGet(inFlight, Math::max);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                concurrentLoads.decrementAndGet();
                return super.load(clientKey);
            }
        };
        store.save("k", new RateLimitState(1, T0, 0, calendar.dayKey(T0)));
        ActorRateLimiterService service = service(store, props());

        CountDownLatch start = new CountDownLatch(1);
        Callable<RateDecision> call = () -> {
            start.await();
            return service.evaluate("k");
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<RateDecision>> futures = new ArrayList<>();
            futures.add(pool.submit(call));
            futures.add(pool.submit(call));
            start.countDown();

            int allowed = 0;
            for (Future<RateDecision> f : futures) {
                if (f.get(5, TimeUnit.SECONDS).allowed()) allowed++;
            }

            assertThat(allowed).isEqualTo(1);
            assertThat(maxConcurrentLoads.get()).isEqualTo(1);
            assertThat(store.load("k").orElseThrow().tokens()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void midnightPassesWhileWaitingForLock_waiterSeesTheNewDay() throws Exception {
        long beforeMidnight = Instant.parse("2025-02-13T04:59:59.999Z").toEpochMilli(); // 23:59:59.999 EST
        clock.setMillis(beforeMidnight);

        // 1本目の load だけ止めて、ロックを握らせたままにする
        CountDownLatch firstLoading = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        InMemoryRateLimitStateStore store = new InMemoryRateLimitStateStore() {
            @Override
            public Optional<RateLimitState> load(String clientKey) {
                if (first.compareAndSet(true, false)) {
                    firstLoading.countDown();
                    try {
                        releaseFirst.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.load(clientKey);
            }
        };
        // 前日分は使い切っている
        store.save("k", new RateLimitState(3, beforeMidnight, 100, calendar.dayKey(beforeMidnight)));
        ActorRateLimiterService service = service(store, props());

        AtomicReference<Thread> waiterThread = new AtomicReference<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<RateDecision> holder = pool.submit(() -> service.evaluate("k"));
            assertThat(firstLoading.await(5, TimeUnit.SECONDS)).isTrue();

            Future<RateDecision> waiter = pool.submit(() -> {
                waiterThread.set(Thread.currentThread());
                return service.evaluate("k");
            });
            awaitBlocked(waiterThread);

            // ロック待ちの間に日付が変わる
            clock.advanceMillis(1);
            releaseFirst.countDown();

            assertThat(holder.get(5, TimeUnit.SECONDS).denial()).isEqualTo(Denial.DAILY);
            RateDecision waited = waiter.get(5, TimeUnit.SECONDS);
            assertThat(waited.allowed()).isTrue();
            assertThat(waited.dailyRemaining()).isEqualTo(99);
        } finally {
            pool.shutdownNow();
        }

        clock.advanceMillis(334);
        assertThat(service.evaluate("k").dailyRemaining()).isEqualTo(98);
        RateLimitState saved = store.load("k").orElseThrow();
        assertThat(saved.dayKey()).isEqualTo("2025-02-13");
        assertThat(saved.dayCount()).isEqualTo(2);
    }

    @Test
    void differentKeysHaveIndependentQuotas() {
        ActorRateLimiterService service = service(new InMemoryRateLimitStateStore(), props());

        for (int i = 0; i < 3; i++) {
            assertThat(service.evaluate("a").allowed()).isTrue();
        }
        assertThat(service.evaluate("a").allowed()).isFalse();
        assertThat(service.evaluate("b").allowed()).isTrue();
    }

    @Test
    void idleActorsAreEvictedButStateSurvivesInStore() {
        RateLimitProperties props = props();
        props.setIdleEvictSeconds(1);
        InMemoryRateLimitStateStore store = new InMemoryRateLimitStateStore();
        ActorRateLimiterService service = service(store, props);

        service.evaluate("a");
        clock.advanceMillis(2_000);
        service.evaluate("b");

        assertThat(service.actorCount()).isEqualTo(1);

        RateDecision again = service.evaluate("a");
        assertThat(again.dailyRemaining()).isEqualTo(98);
        assertThat(store.load("a").orElseThrow().dayCount()).isEqualTo(2);
    }

    @Test
    void decisionsAreCountedByOutcome() {
        RateLimitStateStore broken = mock(RateLimitStateStore.class);
        when(broken.load(anyString())).thenThrow(new StateStoreException("down", new RuntimeException()));
        ActorRateLimiterService service = service(new InMemoryRateLimitStateStore(), props());
        ActorRateLimiterService failing = service(broken, props());

        for (int i = 0; i < 4; i++) {
            service.evaluate("k");
        }
        assertThatThrownBy(() -> failing.evaluate("k")).isInstanceOf(ActorUnavailableException.class);

        assertThat(count("allowed")).isEqualTo(3.0);
        assertThat(count("denied_burst")).isEqualTo(1.0);
        assertThat(count("denied_daily")).isZero();
        assertThat(count("unavailable")).isEqualTo(1.0);
    }

    @Test
    void dailyDenialIsCountedSeparately() {
        RateLimitProperties props = props();
        props.setDayLimit(1);
        ActorRateLimiterService service = service(new InMemoryRateLimitStateStore(), props);

        assertThat(service.evaluate("k").allowed()).isTrue();
        RateDecision denied = service.evaluate("k");

        assertThat(denied.denial()).isEqualTo(Denial.DAILY);
        assertThat(count("denied_daily")).isEqualTo(1.0);
    }

    private static void awaitBlocked(AtomicReference<Thread> ref) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Thread t = ref.get();
            if (t != null && t.getState() == Thread.State.TIMED_WAITING) {
                return;
            }
            Thread.sleep(5);
        }
        throw new AssertionError("waiter never blocked on the rate limiter lock");
    }

    private ActorRateLimiterService service(RateLimitStateStore store, RateLimitProperties props) {
        return new ActorRateLimiterService(props, store, calendar, clock, registry);
    }

    private static RateLimitProperties props() {
        RateLimitProperties props = new RateLimitProperties();
        props.setIdleEvictSeconds(0);
        return props;
    }

    private double count(String outcome) {
        return registry.get("gatekeeper_decisions_total").tag("outcome", outcome).counter().count();
    }
}
