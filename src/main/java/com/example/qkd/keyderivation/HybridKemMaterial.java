package com.example.qkd.keyderivation;

import com.example.qkd.exception.QkdException;
import com.example.qkd.service.RandomSourceProvider;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.util.Arrays;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 混合模式的附加密钥材料：ML-KEM-768 封装/解封得到的共享秘密。
 * 服务启动时生成一对 ML-KEM 密钥，每次请求重新封装一次。
 */
@Slf4j
@Component
public class HybridKemMaterial {

    private final SecureRandom random;
    private final AsymmetricCipherKeyPair keyPair;

    public HybridKemMaterial(RandomSourceProvider randomSourceProvider) {
        this.random = randomSourceProvider.newRandom();

        MLKEMKeyPairGenerator kpg = new MLKEMKeyPairGenerator();
        kpg.init(new MLKEMKeyGenerationParameters(random, MLKEMParameters.ml_kem_768));
        this.keyPair = kpg.generateKeyPair();

        log.info("ML-KEM-768 key pair initialised for hybrid derivation");
    }

    public byte[] freshSharedSecret() {
        MLKEMGenerator generator = new MLKEMGenerator(random);
        SecretWithEncapsulation swe = generator.generateEncapsulated(keyPair.getPublic());

        byte[] secret = swe.getSecret();
        byte[] extracted = new MLKEMExtractor((MLKEMPrivateKeyParameters) keyPair.getPrivate())
                .extractSecret(swe.getEncapsulation());

        if (!Arrays.constantTimeAreEqual(secret, extracted)) {
            throw new QkdException("ML-KEM decapsulation mismatch");
        }
        Arrays.fill(extracted, (byte) 0);
        return secret;
    }
}
