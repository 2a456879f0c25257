package com.example.qkd.service;

import com.example.qkd.config.QkdProperties;
import com.example.qkd.exception.QkdConfigurationException;
import org.springframework.stereotype.Component;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * 模拟用随机源。算法名配错时启动即失败，而不是退回默认实现。
 */
@Component
public class RandomSourceProvider {

    private final String algorithm;

    public RandomSourceProvider(QkdProperties props) {
        this.algorithm = props.getRandom().getAlgorithm();
        // 启动时先试一次
        newRandom();
    }

    public SecureRandom newRandom() {
        if (algorithm == null || algorithm.isBlank()) {
            return new SecureRandom();
        }
        try {
            return SecureRandom.getInstance(algorithm.trim());
        } catch (NoSuchAlgorithmException e) {
            throw new QkdConfigurationException("SecureRandom algorithm not available: " + algorithm, e);
        }
    }
}
