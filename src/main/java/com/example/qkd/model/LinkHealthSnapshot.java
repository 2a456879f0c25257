package com.example.qkd.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 链路健康记录的不可变快照。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class LinkHealthSnapshot {

    public static final LinkHealthSnapshot BASELINE =
            new LinkHealthSnapshot(LinkStatus.GREEN, 0.0, 0L, 0L, 0, false);

    private final LinkStatus status;
    private final double lastQber;
    private final long keysIssued;
    private final long attacksDetected;
    private final int activeSessions;

    /** 运维是否强制开启了窃听模拟 */
    private final boolean attackForced;

    public LinkHealthSnapshot withKeysIssued(long keysIssued) {
        return new LinkHealthSnapshot(status, lastQber, keysIssued, attacksDetected, activeSessions, attackForced);
    }

    public LinkHealthSnapshot withActiveSessions(int activeSessions) {
        return new LinkHealthSnapshot(status, lastQber, keysIssued, attacksDetected, activeSessions, attackForced);
    }

    public LinkHealthSnapshot withAttackForced(boolean attackForced) {
        return new LinkHealthSnapshot(status, lastQber, keysIssued, attacksDetected, activeSessions, attackForced);
    }
}
