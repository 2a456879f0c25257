package com.example.scene.qkdsystem;

import com.example.qkd.config.QkdProperties;
import com.example.qkd.keyderivation.HybridKemMaterial;
import com.example.qkd.keyderivation.KeyDerivation;
import com.example.qkd.service.KeyManager;
import com.example.qkd.service.RandomSourceProvider;
import com.example.qkd.simulator.QuantumChannelSimulator;
import com.example.qkd.util.HexCodec;

import java.time.Clock;

/**
 * 不起 Spring 容器，直接手工装配 KeyManager。
 */
final class TestKeyManagers {

    private TestKeyManagers() {
    }

    static KeyManager create(QkdProperties props, Clock clock) {
        RandomSourceProvider random = new RandomSourceProvider(props);
        return new KeyManager(
                props,
                new QuantumChannelSimulator(),
                new KeyDerivation(),
                new HybridKemMaterial(random),
                random,
                new HexCodec(),
                clock);
    }

    static KeyManager create(QkdProperties props) {
        return create(props, Clock.systemUTC());
    }
}
