package com.example.qkd.service;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * 两方演示用的配对槽位（不是多方密钥协商）。
 *
 * 规则：
 *  1) 设备 A 一次新跑通过后打开槽位：{发起方 A, 密钥, 模式, epoch, 打开时间}
 *  2) 窗口期内、同模式、且不是 A 的第一台设备 B 可以领取同一把密钥，领取后槽位关闭
 *  3) 其他情况一律重新跑模拟；拒绝 / reset / A 的会话被注销都会关闭槽位
 *
 * 非线程安全，只在 KeyManager 的锁内使用。
 */
public class PairingSlot {

    private final Duration window;

    private String initiatorId;
    private byte[] sessionKey;
    private boolean hybrid;
    private double qber;
    private Instant openedAt;
    @Getter
    private long epoch;

    public PairingSlot(Duration window) {
        this.window = window;
    }

    public void open(String initiatorId, byte[] sessionKey, boolean hybrid, double qber, Instant now) {
        this.initiatorId = initiatorId;
        this.sessionKey = sessionKey.clone();
        this.hybrid = hybrid;
        this.qber = qber;
        this.openedAt = now;
        this.epoch++;
    }

    public boolean isOpen() {
        return initiatorId != null;
    }

    public Optional<String> initiator() {
        return Optional.ofNullable(initiatorId);
    }

    /**
     * 尝试领取。成功则槽位关闭（第二个位置已被占用）。
     */
    public Optional<Claim> tryClaim(String deviceId, boolean hybrid, Instant now) {
        if (!isOpen()) {
            return Optional.empty();
        }
        if (now.isAfter(openedAt.plus(window))) {
            // 过期
            close();
            return Optional.empty();
        }
        if (initiatorId.equals(deviceId) || this.hybrid != hybrid) {
            return Optional.empty();
        }
        Claim claim = new Claim(initiatorId, sessionKey, qber, epoch);
        close();
        return Optional.of(claim);
    }

    public void close() {
        initiatorId = null;
        if (sessionKey != null) {
            Arrays.fill(sessionKey, (byte) 0);
        }
        sessionKey = null;
        openedAt = null;
    }

    @Getter
    public static final class Claim {
        private final String initiatorId;
        private final byte[] sessionKey;
        private final double qber;
        private final long epoch;

        private Claim(String initiatorId, byte[] sessionKey, double qber, long epoch) {
            this.initiatorId = initiatorId;
            this.sessionKey = sessionKey.clone();
            this.qber = qber;
            this.epoch = epoch;
        }

        public byte[] getSessionKey() {
            return sessionKey.clone();
        }
    }
}
