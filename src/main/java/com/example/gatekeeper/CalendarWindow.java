package com.example.gatekeeper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 基準タイムゾーンでの「暦日」を扱う。
 * UTC でも呼び出し側のローカルでもなく、固定のゾーン（デフォルトは米国東部）で日付を切る。
 * 夏時間の切り替え日（23時間/25時間の日）もゾーンルールに任せて正しく数える。
 */
public final class CalendarWindow {
    private final ZoneId zone;

    public CalendarWindow(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() { return zone; }

    /** 例: "2025-02-12" */
    public String dayKey(long nowMillis) {
        return localDate(nowMillis).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /** nowMillis から、基準タイムゾーンの次の 0:00 までのミリ秒 */
    public long msUntilNextMidnight(long nowMillis) {
        ZonedDateTime nextMidnight = localDate(nowMillis).plusDays(1).atStartOfDay(zone);
        return Math.max(0L, nextMidnight.toInstant().toEpochMilli() - nowMillis);
    }

    private LocalDate localDate(long nowMillis) {
        return Instant.ofEpochMilli(nowMillis).atZone(zone).toLocalDate();
    }
}
