package com.example.qkd.config;

import com.example.qkd.enforcement.UnknownStatusPolicy;
import com.example.qkd.exception.QkdConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "qkd")
public class QkdProperties {

    private Simulation simulation = new Simulation();
    private Link link = new Link();
    private Derivation derivation = new Derivation();
    private Pairing pairing = new Pairing();
    private RandomSource random = new RandomSource();
    private Enforcement enforcement = new Enforcement();

    @Setter
    @Getter
    public static class Simulation {
        /** 每次模拟发送的原始比特位数 */
        private int bitCount = 2048;

        /** 有窃听者时，单个比特被截获的概率 */
        private double interceptRate = 1.0;

        /** 信道基础噪声（独立的比特翻转概率） */
        private double noiseLevel = 0.0;

        /** 筛选后公开用于估计 QBER 的比例，公开部分不再作为密钥材料 */
        private double sampleFraction = 0.15;

        /** 拼成原始密钥的保留比特数 */
        private int rawSecretBits = 256;

        /** 密钥材料不足时最多重跑几次 */
        private int maxAttempts = 3;
    }

    @Setter
    @Getter
    public static class Link {
        /** 低于该值为 GREEN */
        private double safeThreshold = 0.05;

        /** 达到该值为 RED，超过该值判定存在窃听 */
        private double securityThreshold = 0.11;
    }

    @Setter
    @Getter
    public static class Derivation {
        private String label = "QSTCS-SessionKey-BB84";
        private String hybridLabel = "QSTCS-SessionKey-BB84+ML-KEM";
    }

    @Setter
    @Getter
    public static class Pairing {
        private boolean enabled = true;

        /** 配对槽位打开后可被第二台设备领取的时长 */
        private Duration window = Duration.ofSeconds(30);
    }

    @Setter
    @Getter
    public static class RandomSource {
        /** SecureRandom 算法名，空表示平台默认实现 */
        private String algorithm;
    }

    @Setter
    @Getter
    public static class Enforcement {
        private boolean enabled = false;

        private Duration pollInterval = Duration.ofSeconds(3);

        private UnknownStatusPolicy unknownPolicy = UnknownStatusPolicy.BLOCK;

        /** IN_PROCESS：直接读本进程 KeyManager；HTTP：轮询 kmsUrl */
        private SourceType source = SourceType.IN_PROCESS;

        private String kmsUrl = "http://127.0.0.1:8000/link_status";

        private Duration httpTimeout = Duration.ofSeconds(5);

        private FilterType filter = FilterType.LOGGING;

        /** e.g. iptables -I FORWARD -p tcp --dport 8765 -j DROP */
        private List<String> blockCommands = new ArrayList<>();

        /** e.g. iptables -D FORWARD -p tcp --dport 8765 -j DROP */
        private List<String> allowCommands = new ArrayList<>();

        private Duration commandTimeout = Duration.ofSeconds(10);

        /** 停止时是否解除封禁 */
        private boolean releaseOnStop = true;
    }

    public enum SourceType {
        IN_PROCESS,
        HTTP
    }

    public enum FilterType {
        LOGGING,
        COMMAND
    }

    /**
     * 启动时校验，配置错误直接失败。
     */
    public void validate() {
        if (simulation.bitCount <= 0) {
            throw new QkdConfigurationException("qkd.simulation.bit-count must be positive: " + simulation.bitCount);
        }
        if (simulation.rawSecretBits <= 0 || simulation.rawSecretBits % 8 != 0) {
            throw new QkdConfigurationException(
                    "qkd.simulation.raw-secret-bits must be a positive multiple of 8: " + simulation.rawSecretBits);
        }
        if (simulation.maxAttempts < 1) {
            throw new QkdConfigurationException("qkd.simulation.max-attempts must be >= 1: " + simulation.maxAttempts);
        }
        checkProbability("qkd.simulation.intercept-rate", simulation.interceptRate);
        checkProbability("qkd.simulation.noise-level", simulation.noiseLevel);
        if (!(simulation.sampleFraction > 0.0 && simulation.sampleFraction < 1.0)) {
            throw new QkdConfigurationException(
                    "qkd.simulation.sample-fraction must be in (0,1): " + simulation.sampleFraction);
        }
        checkProbability("qkd.link.safe-threshold", link.safeThreshold);
        checkProbability("qkd.link.security-threshold", link.securityThreshold);
        if (link.safeThreshold > link.securityThreshold) {
            throw new QkdConfigurationException("qkd.link.safe-threshold (" + link.safeThreshold
                    + ") must not exceed qkd.link.security-threshold (" + link.securityThreshold + ")");
        }
        if (derivation.label == null || derivation.label.isBlank()
                || derivation.hybridLabel == null || derivation.hybridLabel.isBlank()) {
            throw new QkdConfigurationException("qkd.derivation labels must not be blank");
        }
        if (derivation.label.equals(derivation.hybridLabel)) {
            throw new QkdConfigurationException("qkd.derivation.label and hybrid-label must differ");
        }
        if (pairing.window == null || pairing.window.isNegative()) {
            throw new QkdConfigurationException("qkd.pairing.window must not be negative");
        }
    }

    private static void checkProbability(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new QkdConfigurationException(name + " must be in [0,1]: " + v);
        }
    }
}
