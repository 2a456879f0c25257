package com.example.scene.qkdsystem;

import com.example.qkd.exception.InsufficientKeyMaterialException;
import com.example.qkd.exception.QkdConfigurationException;
import com.example.qkd.simulator.QuantumChannelSimulator;
import com.example.qkd.simulator.SimulationParameters;
import com.example.qkd.simulator.SimulationResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QuantumChannelSimulatorTest {

    private final QuantumChannelSimulator simulator = new QuantumChannelSimulator();

    @Test
    void noEavesdropperNoNoise_qberIsZero() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(1024)
                .eavesdropperPresent(false)
                .noiseLevel(0.0)
                .build();

        for (long seed = 0; seed < 50; seed++) {
            SimulationResult r = simulator.run(params, new Random(seed));
            assertEquals(0.0, r.getQber(), "seed=" + seed);
            assertFalse(r.isEavesdropperDetected(), "seed=" + seed);
            assertEquals(32, r.getRawSecret().length);
            assertEquals(0, r.getInterceptedCount());
        }
    }

    @Test
    void fullInterception_qberStaysInStatisticalBand() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(4096)
                .eavesdropperPresent(true)
                .interceptRate(1.0)
                .build();

        double sum = 0;
        int trials = 40;
        for (long seed = 0; seed < trials; seed++) {
            SimulationResult r = simulator.run(params, new Random(1000 + seed));
            assertTrue(r.getQber() >= 0.15 && r.getQber() <= 0.35, "seed=" + seed + " qber=" + r.getQber());
            assertTrue(r.isEavesdropperDetected());
            assertEquals(4096, r.getInterceptedCount());
            sum += r.getQber();
        }
        double mean = sum / trials;
        assertEquals(0.25, mean, 0.03);
    }

    @Test
    void partialInterception_raisesErrorRateProportionally() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(20000)
                .eavesdropperPresent(true)
                .interceptRate(0.5)
                .build();

        SimulationResult r = simulator.run(params, new Random(7));
        // 期望 0.125
        assertTrue(r.getQber() > 0.07 && r.getQber() < 0.18, "qber=" + r.getQber());
    }

    @Test
    void channelNoise_showsUpWithoutEavesdropper() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(20000)
                .eavesdropperPresent(false)
                .noiseLevel(0.05)
                .build();

        SimulationResult r = simulator.run(params, new Random(11));
        assertTrue(r.getQber() > 0.02 && r.getQber() < 0.08, "qber=" + r.getQber());
        assertFalse(r.isEavesdropperDetected());
    }

    @Test
    void siftedLength_neverExceedsBitCountAndConcentratesNearHalf() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(10000)
                .build();

        for (long seed = 0; seed < 20; seed++) {
            SimulationResult r = simulator.run(params, new Random(seed));
            assertTrue(r.getSiftedLength() <= 10000);
            assertEquals(5000, r.getSiftedLength(), 300, "seed=" + seed);
            assertEquals(r.getSiftedLength(), r.getSampleSize() + r.getRetainedLength());
            assertEquals((int) Math.ceil(r.getSiftedLength() * 0.15), r.getSampleSize());
        }
    }

    @Test
    void sameSeed_sameResult() {
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(2048)
                .eavesdropperPresent(true)
                .interceptRate(0.3)
                .noiseLevel(0.01)
                .build();

        SimulationResult a = simulator.run(params, new Random(42));
        SimulationResult b = simulator.run(params, new Random(42));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertArrayEquals(a.getRawSecret(), b.getRawSecret());

        SimulationResult c = simulator.run(params, new Random(43));
        assertNotEquals(a, c);
        assertFalse(Arrays.equals(a.getRawSecret(), c.getRawSecret()));
    }

    @Test
    void tightSizing_sometimesRunsShortOfKeyMaterial() {
        // 期望保留 302 * 0.85 ≈ 256.7 位，正好卡在 256 附近
        SimulationParameters params = SimulationParameters.builder()
                .bitCount(604)
                .build();

        int failures = 0;
        int successes = 0;
        for (long seed = 0; seed < 60; seed++) {
            try {
                SimulationResult r = simulator.run(params, new Random(seed));
                assertTrue(r.getRetainedLength() >= 256);
                successes++;
            } catch (InsufficientKeyMaterialException e) {
                assertTrue(e.getRetainedLength() < 256);
                assertEquals(256, e.getRequiredBits());
                failures++;
            }
        }
        assertTrue(failures > 0, "expected at least one short run");
        assertTrue(successes > 0, "expected at least one full run");
    }

    @Test
    void invalidParameters_areRejectedImmediately() {
        Random random = new Random(1);

        assertThrows(QkdConfigurationException.class, () -> simulator.run(
                SimulationParameters.builder().bitCount(-1).build(), random));
        assertThrows(QkdConfigurationException.class, () -> simulator.run(
                SimulationParameters.builder().interceptRate(1.5).build(), random));
        assertThrows(QkdConfigurationException.class, () -> simulator.run(
                SimulationParameters.builder().noiseLevel(-0.1).build(), random));
        assertThrows(QkdConfigurationException.class, () -> simulator.run(
                SimulationParameters.builder().sampleFraction(0.0).build(), random));
        // 期望保留位数不够 256
        assertThrows(QkdConfigurationException.class, () -> simulator.run(
                SimulationParameters.builder().bitCount(512).build(), random));
    }
}
