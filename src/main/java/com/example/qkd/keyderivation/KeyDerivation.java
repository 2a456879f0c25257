package com.example.qkd.keyderivation;

import com.example.qkd.exception.QkdConfigurationException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.util.Arrays;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * HKDF-SHA256（extract-and-expand），label 作为 info 参数做域分离。
 * 纯函数：相同 (secret, label) 永远得到相同的 32 字节输出。
 */
@Component
public class KeyDerivation {

    public static final int SESSION_KEY_BYTES = 32;

    // 1) 原始密钥 -> 会话密钥
    public byte[] derive(byte[] rawSecret, String label) {
        if (rawSecret == null || rawSecret.length == 0) {
            throw new QkdConfigurationException("raw secret must not be empty");
        }
        if (label == null) {
            throw new QkdConfigurationException("derivation label must not be null");
        }

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        // salt 为空时 HKDF 使用 HashLen 个 0 字节（RFC 5869）
        hkdf.init(new HKDFParameters(rawSecret, null, label.getBytes(StandardCharsets.UTF_8)));

        byte[] out = new byte[SESSION_KEY_BYTES];
        hkdf.generateBytes(out, 0, out.length);
        return out;
    }

    // 2) 混合模式：BB84 原始密钥 || ML-KEM 共享秘密，再走 HKDF
    public byte[] deriveHybrid(byte[] rawSecret, byte[] kemSecret, String hybridLabel) {
        if (kemSecret == null || kemSecret.length == 0) {
            throw new QkdConfigurationException("KEM shared secret must not be empty");
        }
        if (rawSecret == null || rawSecret.length == 0) {
            throw new QkdConfigurationException("raw secret must not be empty");
        }
        byte[] ikm = Arrays.concatenate(rawSecret, kemSecret);
        try {
            return derive(ikm, hybridLabel);
        } finally {
            Arrays.fill(ikm, (byte) 0);
        }
    }
}
