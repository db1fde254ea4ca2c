package com.example.gatekeeper;

/**
 * 信頼済みヘッダからクライアントを特定できなかった。転送もレート判定もしない。
 */
public class MissingClientIdentityException extends GatekeeperException {

    public MissingClientIdentityException(String headerName) {
        super("MISSING_IDENTITY", "No client identity in header " + headerName);
    }
}
