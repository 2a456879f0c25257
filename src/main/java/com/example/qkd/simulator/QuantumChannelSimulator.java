package com.example.qkd.simulator;

import com.example.qkd.exception.InsufficientKeyMaterialException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * BB84 信道的经典统计模拟。
 *
 * 无状态、无 I/O：除随机数外是纯函数，传入固定种子的 Random 即可复现一次运行。
 * 模拟目的只是复现 BB84 的可检测性（截获重发会把误码率抬到 ~25%），不对物理量子比特建模。
 *
 * 基的编码：0 = 直线基（rectilinear），1 = 对角基（diagonal）。
 * 原始密钥按 MSB-first 打包：第一个保留比特是第一个字节的最高位。
 */
@Slf4j
@Component
public class QuantumChannelSimulator {

    public SimulationResult run(SimulationParameters params, Random random) {
        params.validate();

        int n = params.getBitCount();

        // 1) 发送方比特 + 基，接收方基，逐位独立均匀
        byte[] aliceBits = new byte[n];
        byte[] aliceBases = new byte[n];
        byte[] bobBases = new byte[n];
        for (int i = 0; i < n; i++) {
            aliceBits[i] = (byte) random.nextInt(2);
            aliceBases[i] = (byte) random.nextInt(2);
            bobBases[i] = (byte) random.nextInt(2);
        }

        // 2) ~ 4) 传输：截获重发 -> 噪声 -> 接收方测量
        byte[] bobBits = new byte[n];
        int intercepted = 0;
        for (int i = 0; i < n; i++) {
            int channelBit = aliceBits[i];

            if (params.isEavesdropperPresent() && random.nextDouble() < params.getInterceptRate()) {
                intercepted++;
                int eveBasis = random.nextInt(2);
                if (eveBasis != aliceBases[i]) {
                    // 基不一致：重发出去的比特以 0.5 概率与原值不同
                    channelBit = random.nextInt(2);
                }
            }

            if (params.getNoiseLevel() > 0.0 && random.nextDouble() < params.getNoiseLevel()) {
                channelBit ^= 1;
            }

            if (bobBases[i] == aliceBases[i]) {
                bobBits[i] = (byte) channelBit;
            } else {
                // 基不一致时测量结果随机，这些位置在筛选时会被丢弃
                bobBits[i] = (byte) random.nextInt(2);
            }
        }

        // 4) 筛选：只保留双方基一致的位置
        int[] sifted = new int[n];
        int siftedLength = 0;
        for (int i = 0; i < n; i++) {
            if (aliceBases[i] == bobBases[i]) {
                sifted[siftedLength++] = i;
            }
        }

        // 5) 从筛选结果里随机抽出公开样本（部分 Fisher-Yates，样本放在前 sampleSize 个）
        int sampleSize = (int) Math.ceil(siftedLength * params.getSampleFraction());
        if (sampleSize == 0) {
            throw new InsufficientKeyMaterialException(
                    "empty disclosed sample, QBER undefined (sifted=" + siftedLength + ")",
                    siftedLength, 0, params.getRawSecretBits());
        }
        int[] order = sifted.clone();
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(siftedLength - i);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        boolean[] disclosed = new boolean[n];
        for (int i = 0; i < sampleSize; i++) {
            disclosed[order[i]] = true;
        }

        int retainedLength = siftedLength - sampleSize;
        if (retainedLength < params.getRawSecretBits()) {
            throw new InsufficientKeyMaterialException(
                    "insufficient key material: retained " + retainedLength
                            + " bits, need " + params.getRawSecretBits(),
                    siftedLength, retainedLength, params.getRawSecretBits());
        }

        // 6) QBER 只在公开样本上统计
        int sampleErrors = 0;
        for (int i = 0; i < sampleSize; i++) {
            int pos = order[i];
            if (aliceBits[pos] != bobBits[pos]) {
                sampleErrors++;
            }
        }
        double qber = (double) sampleErrors / sampleSize;

        // 7)
        boolean detected = qber > params.getSecurityThreshold();

        // 8) 保留部分按原顺序取前 rawSecretBits 位打包，公开样本位绝不进入密钥
        byte[] rawSecret = new byte[params.rawSecretBytes()];
        int written = 0;
        for (int k = 0; k < siftedLength && written < params.getRawSecretBits(); k++) {
            int pos = sifted[k];
            if (disclosed[pos]) {
                continue;
            }
            if (aliceBits[pos] != 0) {
                rawSecret[written >>> 3] |= (byte) (0x80 >>> (written & 7));
            }
            written++;
        }

        log.debug("BB84 run: bits={}, eve={}, intercepted={}, sifted={}, sample={}, errors={}, qber={}",
                n, params.isEavesdropperPresent(), intercepted, siftedLength, sampleSize, sampleErrors, qber);

        return new SimulationResult(rawSecret, qber, detected,
                siftedLength, sampleSize, sampleErrors, retainedLength, intercepted);
    }
}
