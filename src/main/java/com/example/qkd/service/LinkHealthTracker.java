package com.example.qkd.service;

import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatus;

/**
 * 链路健康记录（进程内唯一一份，由 KeyManager 持有）。
 *
 * 写：只在 KeyManager 的锁内调用，每次修改生成一份新快照，一次 volatile 写发布出去；
 * 读：{@link #snapshot()} 无锁，读到的一定是某次完整提交后的状态。
 */
public class LinkHealthTracker {

    private final double safeThreshold;
    private final double securityThreshold;

    private volatile LinkHealthSnapshot current = LinkHealthSnapshot.BASELINE;

    public LinkHealthTracker(double safeThreshold, double securityThreshold) {
        this.safeThreshold = safeThreshold;
        this.securityThreshold = securityThreshold;
    }

    public LinkHealthSnapshot snapshot() {
        return current;
    }

    public LinkStatus classify(double qber, boolean detected) {
        return LinkStatus.classify(qber, detected, safeThreshold, securityThreshold);
    }

    /**
     * 新跑完一次且通过：按本次 QBER 重新分类，发放计数 +1。
     */
    public LinkHealthSnapshot recordAccepted(double qber, int activeSessions) {
        LinkHealthSnapshot s = current;
        current = new LinkHealthSnapshot(classify(qber, false), qber,
                s.getKeysIssued() + 1, s.getAttacksDetected(), activeSessions, s.isAttackForced());
        return current;
    }

    /**
     * 安全拒绝：状态 RED，攻击计数 +1。
     */
    public LinkHealthSnapshot recordRejected(double qber, int activeSessions) {
        LinkHealthSnapshot s = current;
        current = new LinkHealthSnapshot(LinkStatus.RED, qber,
                s.getKeysIssued(), s.getAttacksDetected() + 1, activeSessions, s.isAttackForced());
        return current;
    }

    /**
     * 配对领取：没有新的 QBER，状态不变，只动计数。
     */
    public LinkHealthSnapshot recordPairedIssue(int activeSessions) {
        LinkHealthSnapshot s = current;
        current = s.withKeysIssued(s.getKeysIssued() + 1).withActiveSessions(activeSessions);
        return current;
    }

    public LinkHealthSnapshot recordActiveSessions(int activeSessions) {
        current = current.withActiveSessions(activeSessions);
        return current;
    }

    public LinkHealthSnapshot recordAttackForced(boolean forced) {
        current = current.withAttackForced(forced);
        return current;
    }

    public LinkHealthSnapshot reset() {
        current = LinkHealthSnapshot.BASELINE;
        return current;
    }
}
