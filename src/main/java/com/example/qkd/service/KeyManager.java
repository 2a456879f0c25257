package com.example.qkd.service;

import com.example.qkd.config.QkdProperties;
import com.example.qkd.enforcement.LinkHealthSource;
import com.example.qkd.exception.InsufficientKeyMaterialException;
import com.example.qkd.exception.QkdConfigurationException;
import com.example.qkd.keyderivation.HybridKemMaterial;
import com.example.qkd.keyderivation.KeyDerivation;
import com.example.qkd.model.KeyIssuanceResult;
import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatus;
import com.example.qkd.model.RejectionReason;
import com.example.qkd.model.SessionRecord;
import com.example.qkd.simulator.QuantumChannelSimulator;
import com.example.qkd.simulator.SimulationParameters;
import com.example.qkd.simulator.SimulationResult;
import com.example.qkd.util.HexCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 密钥管理：模拟 BB84 -> 按 QBER 更新链路健康 -> 通过则派生并发放会话密钥。
 *
 * 并发约定：
 *  - 模拟和派生是纯计算，放在锁外，多个设备可以并行跑；
 *  - 会话表、配对槽位、链路健康记录只在 {@code lock} 内一起修改；
 *  - {@link #checkLinkHealth()} 读的是已提交的不可变快照，不等锁。
 */
@Slf4j
@Service
public class KeyManager implements LinkHealthSource {

    private final QkdProperties props;
    private final QuantumChannelSimulator simulator;
    private final KeyDerivation keyDerivation;
    private final HybridKemMaterial hybridKemMaterial;
    private final RandomSourceProvider randomSourceProvider;
    private final HexCodec hexCodec;
    private final Clock clock;

    private final Object lock = new Object();

    // 以下状态只在 lock 内读写
    private final Map<String, SessionRecord> sessions = new HashMap<>();
    private final PairingSlot pairingSlot;
    private final LinkHealthTracker tracker;

    public KeyManager(QkdProperties props,
                      QuantumChannelSimulator simulator,
                      KeyDerivation keyDerivation,
                      HybridKemMaterial hybridKemMaterial,
                      RandomSourceProvider randomSourceProvider,
                      HexCodec hexCodec,
                      Clock clock) {
        props.validate();
        // 参数组合不合理（比如 bitCount 太小）在启动时就暴露出来
        SimulationParameters.from(props, false).validate();

        this.props = props;
        this.simulator = simulator;
        this.keyDerivation = keyDerivation;
        this.hybridKemMaterial = hybridKemMaterial;
        this.randomSourceProvider = randomSourceProvider;
        this.hexCodec = hexCodec;
        this.clock = clock;
        this.pairingSlot = new PairingSlot(props.getPairing().getWindow());
        this.tracker = new LinkHealthTracker(
                props.getLink().getSafeThreshold(),
                props.getLink().getSecurityThreshold());

        log.info("Key manager initialised. bitCount={}, sampleFraction={}, securityThreshold={}, pairing={}",
                props.getSimulation().getBitCount(),
                props.getSimulation().getSampleFraction(),
                props.getLink().getSecurityThreshold(),
                props.getPairing().isEnabled());
    }

    public KeyIssuanceResult getFreshKey(String deviceId) {
        return getFreshKey(deviceId, false, false);
    }

    public KeyIssuanceResult getFreshKey(String deviceId, boolean forceEavesdropper) {
        return getFreshKey(deviceId, forceEavesdropper, false);
    }

    /**
     * 为设备申请一把新的会话密钥。
     *
     * @param deviceId          设备标识
     * @param forceEavesdropper 本次强制带窃听者（与全局强制攻击开关取或）
     * @param hybrid            混合模式：BB84 材料拼接 ML-KEM 共享秘密后再派生
     */
    public KeyIssuanceResult getFreshKey(String deviceId, boolean forceEavesdropper, boolean hybrid) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new QkdConfigurationException("deviceId must not be blank");
        }

        boolean eavesdropper = forceEavesdropper || tracker.snapshot().isAttackForced();

        // 1) 配对槽位：第二台设备直接领同一把密钥，不跑模拟
        if (!eavesdropper && props.getPairing().isEnabled()) {
            synchronized (lock) {
                Optional<PairingSlot.Claim> claim = pairingSlot.tryClaim(deviceId, hybrid, clock.instant());
                if (claim.isPresent()) {
                    return issuePaired(deviceId, claim.get(), hybrid);
                }
            }
        }

        // 2) 模拟 + 派生：锁外
        SimulationParameters params = SimulationParameters.from(props, eavesdropper);
        SimulationResult run;
        try {
            run = runWithRetry(deviceId, params);
        } catch (InsufficientKeyMaterialException e) {
            LinkHealthSnapshot s = tracker.snapshot();
            log.warn("Key material still insufficient after {} attempts. deviceId={}, reason={}",
                    props.getSimulation().getMaxAttempts(), deviceId, e.getMessage());
            return KeyIssuanceResult.rejection(deviceId, RejectionReason.INSUFFICIENT_KEY_MATERIAL,
                    e.getMessage(), s.getLastQber(), s.getStatus());
        }

        LinkStatus observed = tracker.classify(run.getQber(), run.isEavesdropperDetected());
        byte[] sessionKey = null;
        if (observed != LinkStatus.RED) {
            sessionKey = derive(run.getRawSecret(), hybrid);
        }

        // 3) 记账：锁内一次性提交
        synchronized (lock) {
            if (sessionKey == null) {
                pairingSlot.close();
                LinkHealthSnapshot s = tracker.recordRejected(run.getQber(), sessions.size());
                log.warn("Eavesdropper detected, key issuance blocked. deviceId={}, qber={}, threshold={}",
                        deviceId, run.getQber(), props.getLink().getSecurityThreshold());
                return KeyIssuanceResult.rejection(deviceId, RejectionReason.EAVESDROPPER_DETECTED,
                        String.format("QKD link compromised: QBER=%.4f exceeds threshold %.2f",
                                run.getQber(), props.getLink().getSecurityThreshold()),
                        run.getQber(), s.getStatus());
            }

            SessionRecord record = new SessionRecord(deviceId, sessionKey, clock.instant(),
                    run.getQber(), hybrid, false);
            sessions.put(deviceId, record);
            if (props.getPairing().isEnabled()) {
                pairingSlot.open(deviceId, sessionKey, hybrid, run.getQber(), record.getIssuedAt());
            }
            LinkHealthSnapshot s = tracker.recordAccepted(run.getQber(), sessions.size());

            log.info("Fresh key issued. deviceId={}, qber={}, status={}, hybrid={}, key={}...",
                    deviceId, run.getQber(), s.getStatus(), hybrid, hexCodec.prefix(sessionKey, 8));
            return KeyIssuanceResult.success(deviceId, sessionKey, run.getQber(), s.getStatus(), hybrid, false);
        }
    }

    /**
     * 当前链路健康快照，无锁读取。
     */
    @Override
    public LinkHealthSnapshot checkLinkHealth() {
        return tracker.snapshot();
    }

    /**
     * 运维开关：之后的模拟都带窃听者，直到 clear 或 reset。
     */
    public LinkHealthSnapshot forceAttack() {
        synchronized (lock) {
            // 已打开的配对槽位作废，避免下一台设备绕过模拟
            pairingSlot.close();
            LinkHealthSnapshot s = tracker.recordAttackForced(true);
            log.info("Forced attack enabled");
            return s;
        }
    }

    public LinkHealthSnapshot clearForcedAttack() {
        synchronized (lock) {
            LinkHealthSnapshot s = tracker.recordAttackForced(false);
            log.info("Forced attack cleared");
            return s;
        }
    }

    public boolean isAttackForced() {
        return tracker.snapshot().isAttackForced();
    }

    /**
     * 注销某设备的会话（断开 / 轮换）。
     */
    public boolean invalidateSession(String deviceId) {
        synchronized (lock) {
            SessionRecord removed = sessions.remove(deviceId);
            if (removed == null) {
                return false;
            }
            if (pairingSlot.initiator().filter(deviceId::equals).isPresent()) {
                pairingSlot.close();
            }
            tracker.recordActiveSessions(sessions.size());
            log.info("Session invalidated. deviceId={}", deviceId);
            return true;
        }
    }

    public Optional<SessionRecord> findSession(String deviceId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(deviceId));
        }
    }

    /**
     * 恢复到基线：GREEN、QBER 0、计数清零、会话清空、强制攻击关闭。
     */
    public LinkHealthSnapshot resetForDemo() {
        synchronized (lock) {
            sessions.clear();
            pairingSlot.close();
            LinkHealthSnapshot s = tracker.reset();
            log.info("Key manager state reset to baseline");
            return s;
        }
    }

    // -------------------- 内部辅助方法 --------------------

    private KeyIssuanceResult issuePaired(String deviceId, PairingSlot.Claim claim, boolean hybrid) {
        byte[] key = claim.getSessionKey();
        SessionRecord record = new SessionRecord(deviceId, key, clock.instant(), claim.getQber(), hybrid, true);
        sessions.put(deviceId, record);
        LinkHealthSnapshot s = tracker.recordPairedIssue(sessions.size());

        log.info("Paired key issued. deviceId={}, initiator={}, epoch={}, status={}",
                deviceId, claim.getInitiatorId(), claim.getEpoch(), s.getStatus());
        return KeyIssuanceResult.success(deviceId, key, claim.getQber(), s.getStatus(), hybrid, true);
    }

    private SimulationResult runWithRetry(String deviceId, SimulationParameters params) {
        int maxAttempts = props.getSimulation().getMaxAttempts();
        InsufficientKeyMaterialException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return simulator.run(params, randomSourceProvider.newRandom());
            } catch (InsufficientKeyMaterialException e) {
                last = e;
                log.debug("Insufficient key material, retrying. deviceId={}, attempt={}/{}, retained={}, required={}",
                        deviceId, attempt, maxAttempts, e.getRetainedLength(), e.getRequiredBits());
            }
        }
        throw last;
    }

    private byte[] derive(byte[] rawSecret, boolean hybrid) {
        if (!hybrid) {
            return keyDerivation.derive(rawSecret, props.getDerivation().getLabel());
        }
        byte[] kemSecret = hybridKemMaterial.freshSharedSecret();
        return keyDerivation.deriveHybrid(rawSecret, kemSecret, props.getDerivation().getHybridLabel());
    }
}
