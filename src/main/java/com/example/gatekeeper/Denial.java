package com.example.gatekeeper;

/**
 * どの上限で弾かれたか。
 *
 * DAILY:
 *   暦日の上限に達した。トークンが残っていても翌日 0:00 まで拒否。
 *
 * BURST:
 *   短時間に撃ちすぎてバケツが空。次の1トークン分だけ待てば通る。
 */
public enum Denial {
    NONE,
    DAILY,
    BURST
}
