package com.example.gatekeeper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * ゲートキーパー全体の設定値。
 *
 * backend:
 *   "memory" -> InMemoryRateLimitStateStore を使う（単一インスタンス向け）
 *   "redis"  -> RedisRateLimitStateStore を使う（再起動しても状態が残る）
 *
 * origin:
 *   許可されたリクエストの転送先。環境変数 BACKEND_ORIGIN から入れる想定。
 *   空のままだと許可されたリクエストは 500 になる。
 */
@Validated
@ConfigurationProperties(prefix = "gatekeeper")
public class RateLimitProperties {
    /** 1秒あたり補充されるトークン数（平均レート） */
    @Positive
    private int ratePerSecond = 3;

    /** バースト容量（トークンの最大保持量） */
    @Positive
    private int capacity = 3;

    /** 1日（基準タイムゾーンの暦日）あたりの上限リクエスト数 */
    @PositiveOrZero
    private int dayLimit = 100;

    /** 暦日を数える基準タイムゾーン。夏時間あり。 */
    @NotBlank
    private String zone = "America/New_York";

    /** クライアント識別に使う、プロキシが付けてくる信頼済みヘッダ */
    @NotBlank
    private String clientIdentityHeader = "CF-Connecting-IP";

    /** 転送先オリジンのベースURL */
    private String origin = "";

    /**
     * 状態ストアの選択肢:
     *  - "memory" (デフォルト)
     *  - "redis"
     */
    private String backend = "memory";

    /** 同じキーの評価待ちでロックを待つ最大時間。超えたら 502 で閉じる。 */
    @NotNull
    private Duration actorTimeout = Duration.ofSeconds(2);

    /** 使われなくなったアクターを掃除するまでの秒数 (0で無効) */
    @PositiveOrZero
    private long idleEvictSeconds = 600L;

    /** Redis に保存した状態の有効期限。アクセスのたびに延長される。 */
    @NotNull
    private Duration stateTtl = Duration.ofHours(48);

    /** オリジンへの接続タイムアウト */
    @NotNull
    private Duration originConnectTimeout = Duration.ofSeconds(5);

    /** オリジンの応答待ちタイムアウト（生成系の応答は遅いので長め） */
    @NotNull
    private Duration originReadTimeout = Duration.ofSeconds(60);

    public int getRatePerSecond() { return ratePerSecond; }
    public void setRatePerSecond(int ratePerSecond) { this.ratePerSecond = ratePerSecond; }

    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }

    public int getDayLimit() { return dayLimit; }
    public void setDayLimit(int dayLimit) { this.dayLimit = dayLimit; }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public String getClientIdentityHeader() { return clientIdentityHeader; }
    public void setClientIdentityHeader(String clientIdentityHeader) { this.clientIdentityHeader = clientIdentityHeader; }

    public String getOrigin() { return origin; }
    public void setOrigin(String origin) { this.origin = origin; }

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public Duration getActorTimeout() { return actorTimeout; }
    public void setActorTimeout(Duration actorTimeout) { this.actorTimeout = actorTimeout; }

    public long getIdleEvictSeconds() { return idleEvictSeconds; }
    public void setIdleEvictSeconds(long idleEvictSeconds) { this.idleEvictSeconds = idleEvictSeconds; }

    public Duration getStateTtl() { return stateTtl; }
    public void setStateTtl(Duration stateTtl) { this.stateTtl = stateTtl; }

    public Duration getOriginConnectTimeout() { return originConnectTimeout; }
    public void setOriginConnectTimeout(Duration originConnectTimeout) { this.originConnectTimeout = originConnectTimeout; }

    public Duration getOriginReadTimeout() { return originReadTimeout; }
    public void setOriginReadTimeout(Duration originReadTimeout) { this.originReadTimeout = originReadTimeout; }
}
