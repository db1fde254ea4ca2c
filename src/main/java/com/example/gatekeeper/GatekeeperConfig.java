package com.example.gatekeeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class GatekeeperConfig {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperConfig.class);

    /**
     * 判定に使う時計。テストでは固定時計に差し替える。
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CalendarWindow calendarWindow(RateLimitProperties props) {
        ZoneId zone = ZoneId.of(props.getZone());
        log.info("Rate limiter: {} req/s, burst {}, {} req/day (day boundary in {}), state backend={}",
                props.getRatePerSecond(), props.getCapacity(), props.getDayLimit(), zone, props.getBackend());
        return new CalendarWindow(zone);
    }

    /**
     * オリジン転送用。接続と読み取りにタイムアウトを付ける。
     */
    @Bean
    public RestClientCustomizer originTimeoutCustomizer(RateLimitProperties props) {
        return builder -> {
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(props.getOriginConnectTimeout())
                    .followRedirects(HttpClient.Redirect.NEVER)
                    .build();
            JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
            factory.setReadTimeout(props.getOriginReadTimeout());
            builder.requestFactory(factory);
        };
    }
}
