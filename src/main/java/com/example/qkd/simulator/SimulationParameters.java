package com.example.qkd.simulator;

import com.example.qkd.config.QkdProperties;
import com.example.qkd.exception.QkdConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次 BB84 模拟的输入参数（不可变）。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SimulationParameters {

    public static final double DEFAULT_SECURITY_THRESHOLD = 0.11;

    @Builder.Default
    private final int bitCount = 2048;

    private final boolean eavesdropperPresent;

    @Builder.Default
    private final double interceptRate = 1.0;

    @Builder.Default
    private final double noiseLevel = 0.0;

    @Builder.Default
    private final double sampleFraction = 0.15;

    @Builder.Default
    private final int rawSecretBits = 256;

    @Builder.Default
    private final double securityThreshold = DEFAULT_SECURITY_THRESHOLD;

    public static SimulationParameters from(QkdProperties props, boolean eavesdropperPresent) {
        QkdProperties.Simulation sim = props.getSimulation();
        return SimulationParameters.builder()
                .bitCount(sim.getBitCount())
                .eavesdropperPresent(eavesdropperPresent)
                .interceptRate(sim.getInterceptRate())
                .noiseLevel(sim.getNoiseLevel())
                .sampleFraction(sim.getSampleFraction())
                .rawSecretBits(sim.getRawSecretBits())
                .securityThreshold(props.getLink().getSecurityThreshold())
                .build();
    }

    /**
     * 筛选后期望保留下来的比特数：bitCount / 2 * (1 - sampleFraction)。
     */
    public double expectedRetainedBits() {
        return bitCount / 2.0 * (1.0 - sampleFraction);
    }

    public int rawSecretBytes() {
        return rawSecretBits / 8;
    }

    public void validate() {
        if (bitCount <= 0) {
            throw new QkdConfigurationException("bitCount must be positive: " + bitCount);
        }
        if (rawSecretBits <= 0 || rawSecretBits % 8 != 0) {
            throw new QkdConfigurationException("rawSecretBits must be a positive multiple of 8: " + rawSecretBits);
        }
        checkProbability("interceptRate", interceptRate);
        checkProbability("noiseLevel", noiseLevel);
        checkProbability("securityThreshold", securityThreshold);
        if (!(sampleFraction > 0.0 && sampleFraction < 1.0)) {
            throw new QkdConfigurationException("sampleFraction must be in (0,1): " + sampleFraction);
        }
        // 期望值都不够的话，重跑也没有意义，直接拒绝
        if (expectedRetainedBits() < rawSecretBits) {
            throw new QkdConfigurationException(String.format(
                    "bitCount %d too small: expected %.1f retained bits, need %d",
                    bitCount, expectedRetainedBits(), rawSecretBits));
        }
    }

    private static void checkProbability(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new QkdConfigurationException(name + " must be in [0,1]: " + v);
        }
    }
}
