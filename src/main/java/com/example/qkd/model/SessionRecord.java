package com.example.qkd.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 某设备最近一次成功发放的会话。下一次发放直接整体替换，不做修改。
 */
@Getter
@ToString(exclude = "sessionKey")
public class SessionRecord {

    private final String deviceId;
    private final byte[] sessionKey;
    private final Instant issuedAt;
    private final double qber;
    private final boolean hybrid;

    /** true 表示从配对槽位领取，而不是本次新跑出来的 */
    private final boolean paired;

    public SessionRecord(String deviceId,
                         byte[] sessionKey,
                         Instant issuedAt,
                         double qber,
                         boolean hybrid,
                         boolean paired) {
        this.deviceId = deviceId;
        this.sessionKey = sessionKey.clone();
        this.issuedAt = issuedAt;
        this.qber = qber;
        this.hybrid = hybrid;
        this.paired = paired;
    }

    public byte[] getSessionKey() {
        return sessionKey.clone();
    }
}
