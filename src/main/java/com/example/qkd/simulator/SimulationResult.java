package com.example.qkd.simulator;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString(exclude = "rawSecret")
public class SimulationResult {

    private final byte[] rawSecret;
    private final double qber;
    private final boolean eavesdropperDetected;

    private final int siftedLength;
    private final int sampleSize;
    private final int sampleErrors;
    private final int retainedLength;
    private final int interceptedCount;

    public SimulationResult(byte[] rawSecret,
                            double qber,
                            boolean eavesdropperDetected,
                            int siftedLength,
                            int sampleSize,
                            int sampleErrors,
                            int retainedLength,
                            int interceptedCount) {
        this.rawSecret = rawSecret.clone();
        this.qber = qber;
        this.eavesdropperDetected = eavesdropperDetected;
        this.siftedLength = siftedLength;
        this.sampleSize = sampleSize;
        this.sampleErrors = sampleErrors;
        this.retainedLength = retainedLength;
        this.interceptedCount = interceptedCount;
    }

    public byte[] getRawSecret() {
        return rawSecret.clone();
    }
}
